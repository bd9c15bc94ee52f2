package com.agrilink.community.api.validation;

/**
 * Converts Java property paths to the snake_case names clients use.
 */
public final class FieldNames {

    private FieldNames() {
    }

    /**
     * Convert a property path such as {@code items[0].productId} to {@code items[0].product_id}.
     */
    public static String toSnakeCase(String propertyPath) {
        if (propertyPath == null) {
            return null;
        }
        StringBuilder result = new StringBuilder(propertyPath.length() + 8);
        for (int i = 0; i < propertyPath.length(); i++) {
            char c = propertyPath.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && propertyPath.charAt(i - 1) != '.') {
                    result.append('_');
                }
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
