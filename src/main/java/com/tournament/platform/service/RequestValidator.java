package com.tournament.platform.service;

import com.tournament.platform.exception.InvalidRequestException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs bean validation on request objects and reports all violations at once.
 */
@Component
public class RequestValidator {
    
    private final Validator validator;
    
    @Autowired
    public RequestValidator(Validator validator) {
        this.validator = validator;
    }
    
    public void validate(Object request) {
        if (request == null) {
            throw new InvalidRequestException("Request cannot be null");
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining("; "));
            throw new InvalidRequestException(message);
        }
    }
}
