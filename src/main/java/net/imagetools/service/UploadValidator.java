package net.imagetools.service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Locale;
import net.imagetools.config.UploadProperties;
import net.imagetools.exception.ValidationException;
import net.imagetools.model.ImageFormat;
import net.imagetools.model.PixelData;
import net.imagetools.service.transform.ExifMetadataReader;
import net.imagetools.service.transform.ImageCodec;
import org.springframework.stereotype.Component;

/**
 * Admits uploaded bytes: size limit, allowed extension, and content that actually decodes.
 * The stored format comes from the content, not from the file name. Images carrying an EXIF
 * orientation are re-encoded upright, so every later operation sees the pixels as displayed.
 */
@Component
public class UploadValidator {

    private static final float UPRIGHT_REENCODE_QUALITY = 0.92f;

    private final UploadProperties properties;
    private final ExifMetadataReader exifReader;

    public UploadValidator(UploadProperties properties, ExifMetadataReader exifReader) {
        this.properties = properties;
        this.exifReader = exifReader;
    }

    public PixelData validate(String filename, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new ValidationException("file", "Uploaded file is empty");
        }
        long maxBytes = properties.getMaxSize().toBytes();
        if (bytes.length > maxBytes) {
            throw new ValidationException("file", "Uploaded file is " + bytes.length
                + " bytes; the limit is " + maxBytes + " bytes");
        }
        String extension = extensionOf(filename);
        if (!properties.getAllowedExtensions().contains(extension)) {
            throw new ValidationException("filename", "File type '" + extension + "' is not allowed; accepted: "
                + properties.getAllowedExtensions());
        }

        try {
            ImageFormat format = ImageCodec.detectFormat(bytes)
                .orElseThrow(() -> new ValidationException("file", "Uploaded file is not a supported image"));
            BufferedImage image = ImageCodec.decode(bytes);
            if (image == null) {
                throw new ValidationException("file", "Uploaded " + format + " image could not be decoded");
            }
            int orientation = exifReader.orientation(bytes);
            if (orientation == ExifMetadataReader.ORIENTATION_NORMAL) {
                return new PixelData(bytes, format, image.getWidth(), image.getHeight());
            }
            BufferedImage upright = ImageCodec.applyExifOrientation(ImageCodec.toArgb(image), orientation);
            return ImageCodec.encode(upright, format, UPRIGHT_REENCODE_QUALITY);
        } catch (IOException e) {
            throw new ValidationException("file", "Uploaded file could not be read: " + e.getMessage());
        }
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
    }
}
