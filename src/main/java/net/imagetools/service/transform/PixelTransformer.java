package net.imagetools.service.transform;

import java.util.List;
import net.imagetools.domain.operation.AiEditStep;
import net.imagetools.domain.operation.FlipAxis;
import net.imagetools.model.CompressionProfile;
import net.imagetools.model.PixelData;

/**
 * Pure pixel operations. Implementations never touch storage or history and signal
 * failure with {@link net.imagetools.exception.TransformException}, flagged retryable
 * when a second attempt may succeed.
 */
public interface PixelTransformer {

    PixelData resize(PixelData source, int width, int height);

    /**
     * @param clockwiseDegrees one of 90, 180, 270
     */
    PixelData rotate(PixelData source, int clockwiseDegrees);

    PixelData flip(PixelData source, FlipAxis axis);

    PixelData compress(PixelData source, CompressionProfile profile);

    PixelData removeBackground(PixelData source, String modelId);

    /**
     * Applies every step in order and encodes once, so a multi-step edit yields one result.
     */
    PixelData applyAiSteps(PixelData source, List<AiEditStep> steps);
}
