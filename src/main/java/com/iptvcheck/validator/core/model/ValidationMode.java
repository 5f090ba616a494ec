package com.iptvcheck.validator.core.model;

import com.iptvcheck.validator.core.exception.InvalidValidationModeException;

import java.util.Locale;

/**
 * Strictness of playlist validation. {@link #BASIC} only checks what guide matching and
 * playback need; {@link #ADVANCED} adds naming, grouping and stream format advice.
 */
public enum ValidationMode {
    BASIC,
    ADVANCED;

    public static ValidationMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return ADVANCED;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidValidationModeException("Unknown validation mode '" + value + "'. Expected 'basic' or 'advanced'");
        }
    }
}
