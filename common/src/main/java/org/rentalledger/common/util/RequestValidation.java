package org.rentalledger.common.util;

import org.rentalledger.common.exception.ValidationException;

import java.util.Collection;

/**
 * Input checks shared by the rental operations. Each one throws {@link ValidationException}
 * naming the offending field.
 */
public final class RequestValidation {

    private RequestValidation() {
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        return value;
    }

    public static <T> T requireNonNull(T value, String field) {
        if (value == null) {
            throw new ValidationException(field, field + " is required");
        }
        return value;
    }

    public static <C extends Collection<?>> C requireNotEmpty(C values, String field) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException(field, field + " must contain at least one entry");
        }
        return values;
    }

    public static int requirePositive(Integer value, String field) {
        if (value == null || value <= 0) {
            throw new ValidationException(field, field + " must be a positive quantity, got " + value);
        }
        return value;
    }

    public static String requireMaxLength(String value, int maxLength, String field) {
        if (value != null && value.length() > maxLength) {
            throw new ValidationException(field,
                    field + " must be at most " + maxLength + " characters, got " + value.length());
        }
        return value;
    }
}
