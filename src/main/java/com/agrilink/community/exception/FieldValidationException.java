package com.agrilink.community.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception carrying per-field validation messages for input that bean validation cannot check
 * (e.g. references to other rows, multipart values).
 *
 * @author AgriLink Team
 */
public class FieldValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public FieldValidationException(String field, String message) {
        this(Collections.singletonMap(field, message));
    }

    public FieldValidationException(Map<String, String> fieldErrors) {
        super("Validation failed: " + fieldErrors);
        this.fieldErrors = new LinkedHashMap<>(fieldErrors);
    }

    public Map<String, String> getFieldErrors() {
        return Collections.unmodifiableMap(fieldErrors);
    }
}
