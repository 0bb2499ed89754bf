package net.imagetools.service.transform;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.util.Arrays;
import java.util.function.IntUnaryOperator;
import net.imagetools.domain.operation.AiEditStep;
import net.imagetools.domain.operation.OperationKind;
import net.imagetools.exception.TransformException;

/**
 * Renders AI edit steps onto an ARGB image. Each visit returns a new image and never
 * mutates its input; alpha is carried through untouched by the colour steps.
 */
final class AiStepRenderer implements AiEditStep.Visitor<BufferedImage> {

    private final BufferedImage current;
    private final int maxDimension;

    private AiStepRenderer(BufferedImage current, int maxDimension) {
        this.current = current;
        this.maxDimension = maxDimension;
    }

    static BufferedImage render(BufferedImage source, Iterable<AiEditStep> steps, int maxDimension) {
        BufferedImage image = ImageCodec.toArgb(source);
        for (AiEditStep step : steps) {
            image = step.accept(new AiStepRenderer(image, maxDimension));
        }
        return image;
    }

    @Override
    public BufferedImage brightness(AiEditStep.Brightness step) {
        double factor = step.value();
        return mapChannels(c -> clamp(c * factor));
    }

    @Override
    public BufferedImage contrast(AiEditStep.Contrast step) {
        double factor = step.value();
        double mean = meanLuminance(current);
        return mapChannels(c -> clamp(mean + (c - mean) * factor));
    }

    @Override
    public BufferedImage saturation(AiEditStep.Saturation step) {
        double factor = step.value();
        return mapPixels(argb -> {
            int r = (argb >> 16) & 0xFF;
            int g = (argb >> 8) & 0xFF;
            int b = argb & 0xFF;
            double gray = luminance(r, g, b);
            return pack(argb >>> 24,
                clamp(gray + (r - gray) * factor),
                clamp(gray + (g - gray) * factor),
                clamp(gray + (b - gray) * factor));
        });
    }

    @Override
    public BufferedImage rotate(AiEditStep.Rotate step) {
        double radians = Math.toRadians(step.degrees());
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int width = current.getWidth();
        int height = current.getHeight();
        int newWidth = (int) Math.round(width * cos + height * sin);
        int newHeight = (int) Math.round(width * sin + height * cos);
        requireWithinLimit(newWidth, newHeight);

        BufferedImage rotated = new BufferedImage(Math.max(1, newWidth), Math.max(1, newHeight), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = rotated.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        AffineTransform transform = new AffineTransform();
        transform.translate(rotated.getWidth() / 2.0, rotated.getHeight() / 2.0);
        transform.rotate(radians);
        transform.translate(-width / 2.0, -height / 2.0);
        g.drawImage(current, transform, null);
        g.dispose();
        return rotated;
    }

    @Override
    public BufferedImage crop(AiEditStep.Crop step) {
        int x1 = Math.min(step.x1(), current.getWidth());
        int y1 = Math.min(step.y1(), current.getHeight());
        int x2 = Math.min(step.x2(), current.getWidth());
        int y2 = Math.min(step.y2(), current.getHeight());
        if (x2 <= x1 || y2 <= y1) {
            throw new TransformException(OperationKind.AI_EDIT,
                "crop box " + step.parameters().get("box") + " lies outside the "
                    + current.getWidth() + "x" + current.getHeight() + " image", false);
        }
        BufferedImage cropped = new BufferedImage(x2 - x1, y2 - y1, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = cropped.createGraphics();
        g.drawImage(current.getSubimage(x1, y1, x2 - x1, y2 - y1), 0, 0, null);
        g.dispose();
        return cropped;
    }

    @Override
    public BufferedImage resize(AiEditStep.Resize step) {
        requireWithinLimit(step.width(), step.height());
        return ImageCodec.scale(current, step.width(), step.height());
    }

    @Override
    public BufferedImage blur(AiEditStep.Blur step) {
        int size = step.radius() * 2 + 1;
        float weight = 1.0f / size;
        float[] row = new float[size];
        Arrays.fill(row, weight);
        BufferedImage horizontal = convolve(current, new Kernel(size, 1, row));
        return convolve(horizontal, new Kernel(1, size, row));
    }

    @Override
    public BufferedImage sharpen(AiEditStep.Sharpen step) {
        float amount = (float) (step.factor() - 1.0);
        float[] kernel = {
            0f, -amount, 0f,
            -amount, 1f + 4f * amount, -amount,
            0f, -amount, 0f
        };
        return convolve(current, new Kernel(3, 3, kernel));
    }

    @Override
    public BufferedImage sepia(AiEditStep.Sepia step) {
        return mapPixels(argb -> {
            int r = (argb >> 16) & 0xFF;
            int g = (argb >> 8) & 0xFF;
            int b = argb & 0xFF;
            return pack(argb >>> 24,
                clamp(0.393 * r + 0.769 * g + 0.189 * b),
                clamp(0.349 * r + 0.686 * g + 0.168 * b),
                clamp(0.272 * r + 0.534 * g + 0.131 * b));
        });
    }

    @Override
    public BufferedImage grayscale(AiEditStep.Grayscale step) {
        return mapPixels(argb -> {
            int gray = clamp(luminance((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF));
            return pack(argb >>> 24, gray, gray, gray);
        });
    }

    private void requireWithinLimit(int width, int height) {
        if (width > maxDimension || height > maxDimension) {
            throw new TransformException(OperationKind.AI_EDIT,
                "result " + width + "x" + height + " exceeds the " + maxDimension + " pixel limit", false);
        }
    }

    private BufferedImage mapChannels(IntUnaryOperator channel) {
        return mapPixels(argb -> pack(argb >>> 24,
            channel.applyAsInt((argb >> 16) & 0xFF),
            channel.applyAsInt((argb >> 8) & 0xFF),
            channel.applyAsInt(argb & 0xFF)));
    }

    private BufferedImage mapPixels(IntUnaryOperator pixel) {
        int width = current.getWidth();
        int height = current.getHeight();
        int[] pixels = current.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = pixel.applyAsInt(pixels[i]);
        }
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        result.setRGB(0, 0, width, height, pixels, 0, width);
        return result;
    }

    private static BufferedImage convolve(BufferedImage source, Kernel kernel) {
        BufferedImage target = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        return new ConvolveOp(kernel, ConvolveOp.EDGE_NO_OP, null).filter(source, target);
    }

    private static double meanLuminance(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        double total = 0;
        for (int argb : pixels) {
            total += luminance((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
        }
        return pixels.length == 0 ? 0 : total / pixels.length;
    }

    private static double luminance(int r, int g, int b) {
        return 0.299 * r + 0.587 * g + 0.114 * b;
    }

    private static int clamp(double value) {
        return (int) Math.max(0, Math.min(255, Math.round(value)));
    }

    private static int pack(int alpha, int r, int g, int b) {
        return (alpha << 24) | (r << 16) | (g << 8) | b;
    }
}
