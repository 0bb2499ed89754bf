package net.imagetools.domain.operation;

import java.util.HashMap;
import java.util.Map;

/**
 * Remove the background with a segmentation model. A {@code null} model id asks for
 * the configured default; the recorded operation always names the model used.
 */
public record RemoveBackgroundOperation(String modelId) implements ImageOperation {

    public RemoveBackgroundOperation {
        if (modelId != null && modelId.isBlank()) {
            modelId = null;
        }
    }

    public static RemoveBackgroundOperation withDefaultModel() {
        return new RemoveBackgroundOperation(null);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.REMOVE_BACKGROUND;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("modelId", modelId);
        return parameters;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRemoveBackground(this);
    }
}
