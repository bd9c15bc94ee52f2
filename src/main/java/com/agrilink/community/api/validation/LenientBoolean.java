package com.agrilink.community.api.validation;

import com.agrilink.community.exception.FieldValidationException;

import java.util.Locale;

/**
 * Parses form flags the way browsers and mobile clients send them:
 * true/false, 1/0, yes/no, y/n, on/off, case-insensitive.
 */
public final class LenientBoolean {

    private LenientBoolean() {
    }

    /**
     * Parse an optional flag.
     *
     * @param value Raw value, may be null or blank
     * @param field Field name used in the error
     * @return Parsed value, or null when absent
     * @throws FieldValidationException if the value is not a recognized flag
     */
    public static Boolean parse(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
            case "y":
            case "on":
                return Boolean.TRUE;
            case "false":
            case "0":
            case "no":
            case "n":
            case "off":
                return Boolean.FALSE;
            default:
                throw new FieldValidationException(field,
                        "The " + field + " field must be true/false, 1/0, yes/no, y/n or on/off");
        }
    }
}
