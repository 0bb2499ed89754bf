package net.imagetools.domain.operation;

import java.util.Map;
import net.imagetools.exception.ValidationException;

/**
 * Clockwise rotation by a quarter-turn multiple. Negative values rotate
 * counter-clockwise; full turns are rejected because they change nothing.
 */
public record RotateOperation(int degrees) implements ImageOperation {

    public RotateOperation {
        if (degrees % 90 != 0 || degrees % 360 == 0 || Math.abs(degrees) > 360) {
            throw new ValidationException("degrees",
                "Rotation degrees must be a non-zero multiple of 90 within [-360, 360] but was " + degrees);
        }
    }

    /**
     * Equivalent clockwise rotation in {90, 180, 270}.
     */
    public int normalizedDegrees() {
        return ((degrees % 360) + 360) % 360;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.ROTATE;
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("degrees", degrees);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRotate(this);
    }
}
