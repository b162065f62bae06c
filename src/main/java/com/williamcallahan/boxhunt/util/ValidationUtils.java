package com.williamcallahan.boxhunt.util;

import java.util.Collection;

/**
 * Null-safe checks shared across services
 */
public final class ValidationUtils {

    private ValidationUtils() {
        // Utility class
    }

    public static boolean isNullOrBlank(String value) {
        return value == null || value.isBlank();
    }

    public static boolean hasText(String value) {
        return !isNullOrBlank(value);
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    /**
     * Returns the first non-blank value, or an empty string when every value is blank
     */
    public static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (hasText(value)) {
                return value.trim();
            }
        }
        return "";
    }
}
