package net.imagetools.service.transform;

import java.awt.image.BufferedImage;

/**
 * Segments the foreground of an image and makes everything else transparent.
 */
public interface BackgroundRemover {

    /**
     * @param source decoded image
     * @param modelId validated model id from the configured catalogue
     * @return an ARGB image of the same size with background pixels fully transparent
     */
    BufferedImage removeBackground(BufferedImage source, String modelId);
}
