package com.agrilink.community.exception;

/**
 * Exception thrown when a unique value (e-mail, tip category name) is already taken.
 *
 * @author AgriLink Team
 */
public class DuplicateResourceException extends RuntimeException {

    private final String field;

    public DuplicateResourceException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
