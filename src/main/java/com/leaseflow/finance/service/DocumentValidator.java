package com.leaseflow.finance.service;

import com.leaseflow.finance.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the Bean Validation constraints declared on documents and reports them as a single
 * {@link ValidationException}.
 */
@Component
public class DocumentValidator {

    private final Validator validator;

    public DocumentValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @throws ValidationException naming the first offending field (alphabetically) and listing all
     *         violations in the message
     */
    public void validate(Object document) {
        Set<ConstraintViolation<Object>> violations = validator.validate(document);
        if (violations.isEmpty()) {
            return;
        }

        List<ConstraintViolation<Object>> sorted = violations.stream()
            .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
            .toList();

        String message = sorted.stream()
            .map(v -> v.getPropertyPath() + " " + v.getMessage())
            .collect(Collectors.joining("; "));

        throw new ValidationException(message, sorted.get(0).getPropertyPath().toString());
    }
}
