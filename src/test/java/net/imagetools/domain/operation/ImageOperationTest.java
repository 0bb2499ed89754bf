package net.imagetools.domain.operation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.imagetools.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageOperationTest {

    @Test
    void should_RejectResize_When_DimensionIsNotPositive() {
        assertThatThrownBy(() -> new ResizeOperation(0, 10))
            .isInstanceOf(ValidationException.class)
            .extracting(error -> ((ValidationException) error).getField())
            .isEqualTo("width");
        assertThatThrownBy(() -> new ResizeOperation(10, -1))
            .isInstanceOf(ValidationException.class)
            .extracting(error -> ((ValidationException) error).getField())
            .isEqualTo("height");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 45, 360, -360, 450, 91})
    void should_RejectRotate_When_DegreesAreNotAQuarterTurn(int degrees) {
        assertThatThrownBy(() -> new RotateOperation(degrees)).isInstanceOf(ValidationException.class);
    }

    @Test
    void should_NormalizeCounterClockwiseRotation_When_DegreesAreNegative() {
        assertThat(new RotateOperation(-90).normalizedDegrees()).isEqualTo(270);
        assertThat(new RotateOperation(270).normalizedDegrees()).isEqualTo(270);
        assertThat(new RotateOperation(180).normalizedDegrees()).isEqualTo(180);
    }

    @Test
    void should_ParseFlipAxis_When_CaseDiffers() {
        assertThat(FlipOperation.of("Horizontal").axis()).isEqualTo(FlipAxis.HORIZONTAL);
        assertThat(FlipOperation.of(" vertical ").axis()).isEqualTo(FlipAxis.VERTICAL);
        assertThat(FlipOperation.of("vertical").parameters()).containsEntry("axis", "vertical");
    }

    @Test
    void should_RejectFlip_When_AxisIsUnknown() {
        assertThatThrownBy(() -> FlipOperation.of("diagonal"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("diagonal");
    }

    @Test
    void should_RequireProfileId_When_Compressing() {
        assertThatThrownBy(() -> CompressOperation.withProfile(" ")).isInstanceOf(ValidationException.class);
        assertThat(CompressOperation.withProfile(" web ").profileId()).isEqualTo("web");
    }

    @Test
    void should_TreatBlankModelAsDefault_When_RemovingBackground() {
        assertThat(new RemoveBackgroundOperation("  ").modelId()).isNull();
        assertThat(RemoveBackgroundOperation.withDefaultModel().parameters()).containsEntry("modelId", null);
    }

    @Test
    void should_RejectAiEdit_When_StepsAreEmpty() {
        assertThatThrownBy(() -> new AiEditOperation(List.of())).isInstanceOf(ValidationException.class);
    }

    @Test
    void should_RejectAiStep_When_ValueIsOutOfRange() {
        assertThatThrownBy(() -> new AiEditStep.Brightness(2.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new AiEditStep.Blur(0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new AiEditStep.Crop(10, 10, 5, 20)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new AiEditStep.Saturation(Double.NaN)).isInstanceOf(ValidationException.class);
    }

    @Test
    void should_DescribeStepsInOrder_When_AiEditIsRecorded() {
        AiEditOperation operation = new AiEditOperation(List.of(
            new AiEditStep.Brightness(1.2), new AiEditStep.Grayscale()));

        assertThat(operation.kind()).isEqualTo(OperationKind.AI_EDIT);
        List<Object> types = new ArrayList<>();
        for (Object step : (List<?>) operation.parameters().get("steps")) {
            types.add(((Map<?, ?>) step).get("type"));
        }
        assertThat(types).containsExactly("brightness", "grayscale");
    }

    @Test
    void should_ResolveKind_When_WireOrEnumNameIsGiven() {
        assertThat(OperationKind.fromName("remove-background")).contains(OperationKind.REMOVE_BACKGROUND);
        assertThat(OperationKind.fromName("REMOVE_BACKGROUND")).contains(OperationKind.REMOVE_BACKGROUND);
        assertThat(OperationKind.fromName("sharpen")).isEmpty();
    }
}
