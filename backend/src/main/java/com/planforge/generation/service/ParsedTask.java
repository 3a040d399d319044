package com.planforge.generation.service;

public record ParsedTask(
        String title,
        String description,
        int estimatedMinutes
) {
}
