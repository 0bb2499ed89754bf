package net.imagetools.exception;

/**
 * Undo requested while the image already presents its original upload.
 * RETRYABLE: No
 */
public class NothingToUndoException extends ImageToolsException {
    private final String imageId;

    public NothingToUndoException(String imageId) {
        super("No operations to undo for image " + imageId, false);
        this.imageId = imageId;
    }

    public String getImageId() {
        return imageId;
    }
}
