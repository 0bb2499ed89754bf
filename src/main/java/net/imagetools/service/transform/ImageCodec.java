package net.imagetools.service.transform;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Optional;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import net.imagetools.model.ImageFormat;
import net.imagetools.model.PixelData;

/**
 * ImageIO helpers shared by the transformer and the thumbnail renderer.
 */
public final class ImageCodec {

    private ImageCodec() {
    }

    /**
     * Decodes encoded bytes, returning {@code null} when no installed reader understands them.
     */
    public static BufferedImage decode(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try (ByteArrayInputStream bais = new ByteArrayInputStream(bytes)) {
            return ImageIO.read(bais);
        }
    }

    /**
     * Identifies the container format from the bytes themselves, ignoring any file name.
     */
    public static Optional<ImageFormat> detectFormat(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                return ImageFormat.fromName(reader.getFormatName());
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Whether ImageIO on this runtime can write {@code format}. The stock JDK cannot write WEBP.
     */
    public static boolean canWrite(ImageFormat format) {
        return ImageIO.getImageWritersByFormatName(format.imageIoName()).hasNext();
    }

    /**
     * Chooses the format a result is written in: the requested one when writable, PNG otherwise.
     */
    public static ImageFormat writableFormat(ImageFormat requested) {
        return requested != null && canWrite(requested) ? requested : ImageFormat.PNG;
    }

    /**
     * Encodes {@code image}; {@code quality} (0.0-1.0) only applies to JPEG.
     */
    public static PixelData encode(BufferedImage image, ImageFormat format, float quality) throws IOException {
        ImageFormat target = writableFormat(format);
        BufferedImage prepared = target.supportsTransparency() ? image : flattenToRgb(image);
        byte[] bytes = target == ImageFormat.JPEG
            ? writeJpeg(prepared, quality)
            : writeDefault(prepared, target);
        return new PixelData(bytes, target, prepared.getWidth(), prepared.getHeight());
    }

    /**
     * Copies into {@code TYPE_INT_ARGB} so every operation works on one pixel layout.
     */
    public static BufferedImage toArgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_ARGB) {
            return source;
        }
        BufferedImage argb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        g.drawImage(source, 0, 0, null);
        g.dispose();
        return argb;
    }

    /**
     * Removes alpha by compositing over white; JPEG and BMP writers reject alpha.
     */
    public static BufferedImage flattenToRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, source.getWidth(), source.getHeight());
        g.drawImage(source, 0, 0, null);
        g.dispose();
        return rgb;
    }

    public static BufferedImage scale(BufferedImage source, int width, int height) {
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scaled.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.drawImage(source, 0, 0, width, height, null);
        g.dispose();
        return scaled;
    }

    /**
     * Remaps pixels so an image carrying EXIF orientation {@code orientation} (1-8) displays
     * upright without the tag. Orientation 1 and unknown values return the source unchanged.
     */
    public static BufferedImage applyExifOrientation(BufferedImage source, int orientation) {
        if (orientation < 2 || orientation > 8) {
            return source;
        }
        int width = source.getWidth();
        int height = source.getHeight();
        boolean swap = orientation >= 5;
        BufferedImage upright = new BufferedImage(swap ? height : width, swap ? width : height,
            BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = source.getRGB(x, y);
                switch (orientation) {
                    case 2 -> upright.setRGB(width - 1 - x, y, argb);
                    case 3 -> upright.setRGB(width - 1 - x, height - 1 - y, argb);
                    case 4 -> upright.setRGB(x, height - 1 - y, argb);
                    case 5 -> upright.setRGB(y, x, argb);
                    case 6 -> upright.setRGB(height - 1 - y, x, argb);
                    case 7 -> upright.setRGB(height - 1 - y, width - 1 - x, argb);
                    default -> upright.setRGB(y, width - 1 - x, argb);
                }
            }
        }
        return upright;
    }

    /**
     * Dimensions that fit {@code width x height} inside the box without upscaling.
     */
    public static int[] fitWithin(int width, int height, int maxWidth, int maxHeight, boolean retainAspectRatio) {
        if (width <= maxWidth && height <= maxHeight) {
            return new int[] {width, height};
        }
        if (!retainAspectRatio) {
            return new int[] {Math.min(width, maxWidth), Math.min(height, maxHeight)};
        }
        double ratio = Math.min((double) maxWidth / width, (double) maxHeight / height);
        return new int[] {
            Math.max(1, (int) Math.round(width * ratio)),
            Math.max(1, (int) Math.round(height * ratio))
        };
    }

    private static byte[] writeJpeg(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG ImageWriters available");
        }
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam jpegParams = writer.getDefaultWriteParam();
            jpegParams.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            jpegParams.setCompressionQuality(Math.max(0.0f, Math.min(1.0f, quality)));
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), jpegParams);
            ios.flush();
            return baos.toByteArray();
        } finally {
            writer.dispose();
        }
    }

    private static byte[] writeDefault(BufferedImage image, ImageFormat format) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, format.imageIoName(), baos)) {
                throw new IOException("No ImageWriter accepted " + format + " output");
            }
            return baos.toByteArray();
        }
    }
}
