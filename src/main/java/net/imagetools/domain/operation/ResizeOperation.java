package net.imagetools.domain.operation;

import java.util.Map;
import net.imagetools.exception.ValidationException;

/**
 * Resize to exact target dimensions.
 */
public record ResizeOperation(int width, int height) implements ImageOperation {

    public ResizeOperation {
        if (width <= 0) {
            throw new ValidationException("width", "Width must be greater than 0 but was " + width);
        }
        if (height <= 0) {
            throw new ValidationException("height", "Height must be greater than 0 but was " + height);
        }
    }

    @Override
    public OperationKind kind() {
        return OperationKind.RESIZE;
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("width", width, "height", height);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitResize(this);
    }
}
