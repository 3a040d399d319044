package com.planforge.jobs.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class JobPayloadReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public JobPayloadReader(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public <T> T read(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidJobPayloadException("Job payload is empty");
        }
        T value;
        try {
            value = objectMapper.readValue(payload, type);
        } catch (JsonProcessingException exception) {
            throw new InvalidJobPayloadException("Job payload is malformed: " + exception.getOriginalMessage(), exception);
        }
        if (value == null) {
            throw new InvalidJobPayloadException("Job payload is empty");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .collect(Collectors.joining(", "));
            throw new InvalidJobPayloadException("Invalid job payload: " + message);
        }
        return value;
    }
}
