package net.imagetools.service.storage;

import java.awt.image.BufferedImage;
import java.io.IOException;
import net.imagetools.model.ImageFormat;
import net.imagetools.model.PixelData;
import net.imagetools.service.transform.ImageCodec;

/**
 * Downscales a revision to fit a square box. Images already inside the box are re-encoded
 * at their own size.
 */
public class ThumbnailRenderer {

    private final int maxSize;
    private final float jpegQuality;

    public ThumbnailRenderer(int maxSize, float jpegQuality) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Thumbnail size must be greater than 0");
        }
        this.maxSize = maxSize;
        this.jpegQuality = jpegQuality;
    }

    /**
     * @return the thumbnail, or {@code null} if the bytes could not be decoded
     */
    public PixelData render(byte[] source, ImageFormat sourceFormat) throws IOException {
        BufferedImage image = ImageCodec.decode(source);
        if (image == null) {
            return null;
        }
        int[] size = ImageCodec.fitWithin(image.getWidth(), image.getHeight(), maxSize, maxSize, true);
        BufferedImage scaled = ImageCodec.scale(image, size[0], size[1]);
        return ImageCodec.encode(scaled, ImageCodec.writableFormat(sourceFormat), jpegQuality);
    }

    public int maxSize() {
        return maxSize;
    }
}
