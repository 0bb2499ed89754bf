package net.imagetools.domain.operation;

import java.util.Locale;
import java.util.Map;
import net.imagetools.exception.ValidationException;

/**
 * Mirror the image across the given axis.
 */
public record FlipOperation(FlipAxis axis) implements ImageOperation {

    public FlipOperation {
        if (axis == null) {
            throw new ValidationException("axis", "Flip axis is required");
        }
    }

    public static FlipOperation of(String axis) {
        return new FlipOperation(FlipAxis.parse(axis));
    }

    @Override
    public OperationKind kind() {
        return OperationKind.FLIP;
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("axis", axis.name().toLowerCase(Locale.ROOT));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFlip(this);
    }
}
