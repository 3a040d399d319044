package com.planforge.plans.service;

public class InvalidPlanInputException extends RuntimeException {

    public InvalidPlanInputException(String message) {
        super(message);
    }

    public InvalidPlanInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
