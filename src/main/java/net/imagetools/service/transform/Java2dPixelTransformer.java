package net.imagetools.service.transform;

import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.config.EditProperties;
import net.imagetools.domain.operation.AiEditStep;
import net.imagetools.domain.operation.FlipAxis;
import net.imagetools.domain.operation.OperationKind;
import net.imagetools.exception.ImageToolsException;
import net.imagetools.exception.TransformException;
import net.imagetools.model.CompressionProfile;
import net.imagetools.model.ImageFormat;
import net.imagetools.model.PixelData;
import org.springframework.stereotype.Component;

/**
 * {@link PixelTransformer} built on ImageIO and Java2D.
 *
 * Features:
 * - Keeps the source format when ImageIO can write it, PNG otherwise
 * - Quarter-turn rotation and flips are exact pixel remaps
 * - Compression fits into the profile box and lowers JPEG quality towards the target size
 * - Background removal always yields PNG so the cleared pixels stay transparent
 */
@Slf4j
@Component
public class Java2dPixelTransformer implements PixelTransformer {

    private static final int QUALITY_STEP = 5;
    private static final int MIN_QUALITY = 10;

    private final BackgroundRemover backgroundRemover;
    private final float encodeQuality;
    private final int maxDimension;

    public Java2dPixelTransformer(BackgroundRemover backgroundRemover, EditProperties editProperties) {
        this.backgroundRemover = backgroundRemover;
        this.encodeQuality = editProperties.getEncodeQuality();
        this.maxDimension = editProperties.getMaxDimension();
    }

    @Override
    public PixelData resize(PixelData source, int width, int height) {
        return render(OperationKind.RESIZE, source, source.format(),
            image -> ImageCodec.scale(image, width, height));
    }

    @Override
    public PixelData rotate(PixelData source, int clockwiseDegrees) {
        if (clockwiseDegrees != 90 && clockwiseDegrees != 180 && clockwiseDegrees != 270) {
            throw new TransformException(OperationKind.ROTATE,
                "quarter-turn rotation expects 90, 180 or 270 degrees but got " + clockwiseDegrees, false);
        }
        return render(OperationKind.ROTATE, source, source.format(), image -> {
            int width = image.getWidth();
            int height = image.getHeight();
            boolean swap = clockwiseDegrees != 180;
            BufferedImage rotated = new BufferedImage(swap ? height : width, swap ? width : height,
                BufferedImage.TYPE_INT_ARGB);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int argb = image.getRGB(x, y);
                    switch (clockwiseDegrees) {
                        case 90 -> rotated.setRGB(height - 1 - y, x, argb);
                        case 180 -> rotated.setRGB(width - 1 - x, height - 1 - y, argb);
                        default -> rotated.setRGB(y, width - 1 - x, argb);
                    }
                }
            }
            return rotated;
        });
    }

    @Override
    public PixelData flip(PixelData source, FlipAxis axis) {
        return render(OperationKind.FLIP, source, source.format(), image -> {
            AffineTransform transform = axis == FlipAxis.HORIZONTAL
                ? new AffineTransform(-1, 0, 0, 1, image.getWidth(), 0)
                : new AffineTransform(1, 0, 0, -1, 0, image.getHeight());
            BufferedImage flipped = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
            Graphics2D g = flipped.createGraphics();
            g.drawImage(image, transform, null);
            g.dispose();
            return flipped;
        });
    }

    @Override
    public PixelData compress(PixelData source, CompressionProfile profile) {
        BufferedImage image = decode(OperationKind.COMPRESS, source);
        int[] size = ImageCodec.fitWithin(image.getWidth(), image.getHeight(),
            profile.maxWidth(), profile.maxHeight(), profile.retainAspectRatio());
        BufferedImage fitted = size[0] == image.getWidth() && size[1] == image.getHeight()
            ? ImageCodec.toArgb(image)
            : ImageCodec.scale(image, size[0], size[1]);

        long targetBytes = profile.targetSizeKb() * 1024L;
        int quality = Math.max(MIN_QUALITY, Math.min(100, profile.quality()));
        try {
            PixelData result = ImageCodec.encode(fitted, profile.format(), quality / 100f);
            // Only JPEG responds to quality; other writers produce the same bytes every time
            while (targetBytes > 0 && result.size() > targetBytes
                && result.format() == ImageFormat.JPEG && quality - QUALITY_STEP >= MIN_QUALITY) {
                quality -= QUALITY_STEP;
                result = ImageCodec.encode(fitted, profile.format(), quality / 100f);
            }
            log.debug("Compressed {} to {} using profile {} (quality {}, target {} KB)",
                source, result, profile.id(), quality, profile.targetSizeKb());
            return result;
        } catch (IOException e) {
            throw new TransformException(OperationKind.COMPRESS, "encoding failed: " + e.getMessage(), false, e);
        }
    }

    @Override
    public PixelData removeBackground(PixelData source, String modelId) {
        return render(OperationKind.REMOVE_BACKGROUND, source, ImageFormat.PNG,
            image -> backgroundRemover.removeBackground(image, modelId));
    }

    @Override
    public PixelData applyAiSteps(PixelData source, List<AiEditStep> steps) {
        return render(OperationKind.AI_EDIT, source, source.format(),
            image -> AiStepRenderer.render(image, steps, maxDimension));
    }

    private PixelData render(OperationKind kind,
                             PixelData source,
                             ImageFormat outputFormat,
                             UnaryOperator<BufferedImage> operation) {
        BufferedImage image = decode(kind, source);
        try {
            BufferedImage result = operation.apply(ImageCodec.toArgb(image));
            return ImageCodec.encode(result, outputFormat, encodeQuality);
        } catch (IOException e) {
            throw new TransformException(kind, "encoding failed: " + e.getMessage(), false, e);
        } catch (ImageToolsException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected {} failure on {}: {}", kind.wireName(), source, e.getMessage(), e);
            throw new TransformException(kind, e.getMessage(), true, e);
        }
    }

    private static BufferedImage decode(OperationKind kind, PixelData source) {
        try {
            BufferedImage image = ImageCodec.decode(source.bytes());
            if (image == null) {
                throw new TransformException(kind, "source " + source.format() + " data could not be decoded", false);
            }
            return image;
        } catch (IOException e) {
            throw new TransformException(kind, "source could not be read: " + e.getMessage(), false, e);
        }
    }
}
