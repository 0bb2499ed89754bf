package net.imagetools.domain.operation;

import java.util.Locale;
import net.imagetools.exception.ValidationException;

public enum FlipAxis {
    HORIZONTAL,
    VERTICAL;

    public static FlipAxis parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("axis", "Flip axis is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("axis", "Flip axis must be 'horizontal' or 'vertical' but was '" + value + "'");
        }
    }
}
