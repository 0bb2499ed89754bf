package net.imagetools.service.edit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.domain.operation.AiEditOperation;
import net.imagetools.domain.operation.AiEditStep;
import net.imagetools.exception.ValidationException;
import org.springframework.stereotype.Component;

/**
 * Extracts the edit plan from an assistant reply.
 *
 * <p>The assistant is prompted to end its reply with a fenced block such as
 * <pre>
 * ```json
 * {"operations": [{"type": "brightness", "params": {"value": 1.3}}]}
 * ```
 * </pre>
 * A reply without a block, or whose block is not JSON, is conversation only and yields
 * no plan. A well-formed block naming unknown steps or out-of-range values is rejected.</p>
 */
@Slf4j
@Component
public class AiEditPlanParser {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public AiEditPlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<AiEditOperation> parse(String assistantReply) {
        Optional<String> block = extractBlock(assistantReply);
        if (block.isEmpty()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(block.get());
        } catch (JsonProcessingException e) {
            log.warn("Assistant reply carried a JSON block that does not parse: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        JsonNode operations = root.path("operations");
        if (!operations.isArray() || operations.isEmpty()) {
            return Optional.empty();
        }
        List<AiEditStep> steps = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            steps.add(toStep(operations.get(i), i));
        }
        return Optional.of(new AiEditOperation(steps));
    }

    private static Optional<String> extractBlock(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = FENCED_JSON.matcher(reply);
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        String trimmed = reply.trim();
        if (trimmed.startsWith("{") && trimmed.contains("\"operations\"")) {
            return Optional.of(trimmed);
        }
        return Optional.empty();
    }

    private static AiEditStep toStep(JsonNode node, int index) {
        String field = "operations[" + index + "]";
        String type = node.path("type").asText("").trim().toLowerCase(Locale.ROOT);
        JsonNode params = node.path("params");
        switch (type) {
            case "brightness":
                return new AiEditStep.Brightness(number(params, "value", field));
            case "contrast":
                return new AiEditStep.Contrast(number(params, "value", field));
            case "saturation":
                return new AiEditStep.Saturation(number(params, "value", field));
            case "rotate":
                return new AiEditStep.Rotate(number(params, "degrees", field));
            case "crop":
                return crop(params, field);
            case "resize":
                return new AiEditStep.Resize(integer(params, "width", field), integer(params, "height", field));
            case "blur":
                return new AiEditStep.Blur(integer(params, "radius", field));
            case "sharpen":
                return new AiEditStep.Sharpen(number(params, "factor", field));
            case "sepia":
                return new AiEditStep.Sepia();
            case "grayscale":
                return new AiEditStep.Grayscale();
            default:
                throw new ValidationException(field + ".type", "Unknown AI edit step '" + type + "'");
        }
    }

    private static AiEditStep crop(JsonNode params, String field) {
        JsonNode box = params.path("box");
        if (!box.isArray() || box.size() != 4) {
            throw new ValidationException(field + ".params.box", "Crop box must be [x1, y1, x2, y2]");
        }
        int[] values = new int[4];
        for (int i = 0; i < 4; i++) {
            if (!box.get(i).isNumber()) {
                throw new ValidationException(field + ".params.box", "Crop box values must be numbers");
            }
            values[i] = box.get(i).asInt();
        }
        return new AiEditStep.Crop(values[0], values[1], values[2], values[3]);
    }

    private static double number(JsonNode params, String name, String field) {
        JsonNode value = params.path(name);
        if (!value.isNumber()) {
            throw new ValidationException(field + ".params." + name, "Parameter '" + name + "' must be a number");
        }
        return value.asDouble();
    }

    private static int integer(JsonNode params, String name, String field) {
        JsonNode value = params.path(name);
        if (!value.isNumber()) {
            throw new ValidationException(field + ".params." + name, "Parameter '" + name + "' must be a number");
        }
        return value.asInt();
    }
}
