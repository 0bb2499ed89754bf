package net.imagetools.testutil;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Random;
import javax.imageio.ImageIO;
import net.imagetools.model.ImageFormat;
import net.imagetools.model.PixelData;

/**
 * Generates small encoded images for tests.
 */
public final class TestImages {

    private TestImages() {
    }

    public static byte[] png(int width, int height, Color color) {
        return encode(solid(width, height, color), "png");
    }

    public static byte[] jpeg(int width, int height, Color color) {
        return encode(solid(width, height, color), "jpeg");
    }

    /**
     * Left half {@code left}, right half {@code right}; used to observe flips and rotations.
     */
    public static byte[] splitPng(int width, int height, Color left, Color right) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, x < width / 2 ? left.getRGB() : right.getRGB());
            }
        }
        return encode(image, "png");
    }

    /**
     * Left half {@code left}, right half {@code right}, as JPEG.
     */
    public static byte[] splitJpeg(int width, int height, Color left, Color right) {
        return encode(decode(splitPng(width, height, left, right)), "jpeg");
    }

    /**
     * Adds an EXIF APP1 segment holding only the orientation tag (big-endian TIFF, one IFD0
     * entry), the way cameras mark a sideways capture. Placed after the JFIF APP0 segment.
     */
    public static byte[] withExifOrientation(byte[] jpeg, int orientation) {
        byte[] app1 = {
            (byte) 0xFF, (byte) 0xE1, 0x00, 0x22,
            'E', 'x', 'i', 'f', 0x00, 0x00,
            'M', 'M', 0x00, 0x2A, 0x00, 0x00, 0x00, 0x08,
            0x00, 0x01,
            0x01, 0x12, 0x00, 0x03, 0x00, 0x00, 0x00, 0x01, 0x00, (byte) orientation, 0x00, 0x00,
            0x00, 0x00, 0x00, 0x00
        };
        int insertAt = 2;
        if ((jpeg[2] & 0xFF) == 0xFF && (jpeg[3] & 0xFF) == 0xE0) {
            insertAt = 4 + (((jpeg[4] & 0xFF) << 8) | (jpeg[5] & 0xFF));
        }
        byte[] result = new byte[jpeg.length + app1.length];
        System.arraycopy(jpeg, 0, result, 0, insertAt);
        System.arraycopy(app1, 0, result, insertAt, app1.length);
        System.arraycopy(jpeg, insertAt, result, insertAt + app1.length, jpeg.length - insertAt);
        return result;
    }

    /**
     * Random noise, which compresses badly and makes JPEG size depend on quality.
     */
    public static byte[] noisePng(int width, int height, long seed) {
        Random random = new Random(seed);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, random.nextInt(0xFFFFFF));
            }
        }
        return encode(image, "png");
    }

    public static PixelData pngData(int width, int height, Color color) {
        return new PixelData(png(width, height, color), ImageFormat.PNG, width, height);
    }

    public static PixelData pixelData(byte[] png) {
        BufferedImage image = decode(png);
        return new PixelData(png, ImageFormat.PNG, image.getWidth(), image.getHeight());
    }

    public static BufferedImage decode(byte[] bytes) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw new IllegalArgumentException("Bytes are not a readable image");
            }
            return image;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Color colorAt(byte[] bytes, int x, int y) {
        return new Color(decode(bytes).getRGB(x, y), true);
    }

    private static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int rgb = color.getRGB();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    private static byte[] encode(BufferedImage image, String format) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, format, out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
