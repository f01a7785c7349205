package com.adlanda.resumetailor.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * Malformed input to a constructor or setter. Always local and never retried.
 */
public class ValidationException extends ResumeTailorException {

    private final List<FieldError> fieldErrors;

    public ValidationException(ErrorCode code, List<FieldError> fieldErrors) {
        super(code, describe(fieldErrors));
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public static ValidationException ofField(String field, String message) {
        return ofField(ErrorCode.VALIDATION_ERROR, field, message);
    }

    public static ValidationException ofField(ErrorCode code, String field, String message) {
        return new ValidationException(code, List.of(new FieldError(field, message)));
    }

    public List<FieldError> getFieldErrors() {
        return fieldErrors;
    }

    private static String describe(List<FieldError> errors) {
        if (errors.isEmpty()) {
            return "validation error";
        }
        if (errors.size() == 1) {
            return errors.get(0).toString();
        }
        List<String> parts = new ArrayList<>();
        for (FieldError error : errors) {
            parts.add(error.toString());
        }
        return "multiple validation errors: " + String.join("; ", parts);
    }

    /**
     * A single field-attributed violation.
     */
    public record FieldError(String field, String message) {
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    /**
     * Collects field errors so an entity can report all of them at once.
     */
    public static class Collector {

        private final List<FieldError> errors = new ArrayList<>();

        public Collector add(String field, String message) {
            errors.add(new FieldError(field, message));
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public void throwIfAny() {
            if (hasErrors()) {
                throw new ValidationException(ErrorCode.VALIDATION_ERROR, errors);
            }
        }
    }
}
