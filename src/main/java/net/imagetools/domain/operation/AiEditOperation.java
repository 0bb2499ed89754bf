package net.imagetools.domain.operation;

import java.util.List;
import java.util.Map;
import net.imagetools.exception.ValidationException;

/**
 * One AI chat turn: an ordered list of primitive steps applied as a single revision,
 * so a single undo removes the whole turn.
 */
public record AiEditOperation(List<AiEditStep> steps) implements ImageOperation {

    public AiEditOperation {
        if (steps == null || steps.isEmpty()) {
            throw new ValidationException("steps", "AI edit requires at least one step");
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) == null) {
                throw new ValidationException("steps[" + i + "]", "AI edit step must not be null");
            }
        }
        steps = List.copyOf(steps);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.AI_EDIT;
    }

    @Override
    public Map<String, Object> parameters() {
        List<Map<String, Object>> described = steps.stream()
            .map(step -> Map.<String, Object>of("type", step.type(), "params", step.parameters()))
            .toList();
        return Map.of("steps", described);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAiEdit(this);
    }
}
