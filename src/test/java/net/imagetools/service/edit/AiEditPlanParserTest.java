package net.imagetools.service.edit;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import net.imagetools.domain.operation.AiEditOperation;
import net.imagetools.domain.operation.AiEditStep;
import net.imagetools.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiEditPlanParserTest {

    private final AiEditPlanParser parser = new AiEditPlanParser(new ObjectMapper());

    @Test
    void should_ExtractStepsInOrder_When_ReplyEndsWithFencedBlock() {
        String reply = """
            Sure, I brightened it a little and cropped the edges.
            ```json
            {"operations": [
              {"type": "brightness", "params": {"value": 1.3}},
              {"type": "crop", "params": {"box": [10, 10, 90, 60]}},
              {"type": "grayscale"}
            ]}
            ```
            """;

        Optional<AiEditOperation> plan = parser.parse(reply);

        assertThat(plan).isPresent();
        assertThat(plan.get().steps()).containsExactly(
            new AiEditStep.Brightness(1.3),
            new AiEditStep.Crop(10, 10, 90, 60),
            new AiEditStep.Grayscale());
    }

    @Test
    void should_AcceptBareJson_When_ReplyIsOnlyThePlan() {
        Optional<AiEditOperation> plan = parser.parse("{\"operations\": [{\"type\": \"Sepia\"}]}");

        assertThat(plan).map(AiEditOperation::steps).hasValueSatisfying(
            steps -> assertThat(steps).containsExactly(new AiEditStep.Sepia()));
    }

    @Test
    void should_ReturnEmpty_When_ReplyIsConversationOnly() {
        assertThat(parser.parse("What would you like me to change?")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
    }

    @Test
    void should_ReturnEmpty_When_BlockIsNotJson() {
        assertThat(parser.parse("```json\n{operations: [oops}\n```")).isEmpty();
    }

    @Test
    void should_ReturnEmpty_When_OperationsListIsEmpty() {
        assertThat(parser.parse("```json\n{\"operations\": []}\n```")).isEmpty();
    }

    @Test
    void should_Reject_When_StepTypeIsUnknown() {
        assertThatThrownBy(() -> parser.parse("```json\n{\"operations\": [{\"type\": \"vignette\"}]}\n```"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("vignette");
    }

    @Test
    void should_Reject_When_ParameterIsMissingOrOutOfRange() {
        assertThatThrownBy(() -> parser.parse(
            "```json\n{\"operations\": [{\"type\": \"blur\", \"params\": {}}]}\n```"))
            .isInstanceOf(ValidationException.class)
            .extracting(error -> ((ValidationException) error).getField())
            .isEqualTo("operations[0].params.radius");
        assertThatThrownBy(() -> parser.parse(
            "```json\n{\"operations\": [{\"type\": \"contrast\", \"params\": {\"value\": 9}}]}\n```"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void should_Reject_When_CropBoxIsMalformed() {
        assertThatThrownBy(() -> parser.parse(
            "```json\n{\"operations\": [{\"type\": \"crop\", \"params\": {\"box\": [1, 2, 3]}}]}\n```"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("x1, y1, x2, y2");
    }
}
