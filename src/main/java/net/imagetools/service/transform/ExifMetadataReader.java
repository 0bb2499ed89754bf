package net.imagetools.service.transform;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads EXIF from uploaded bytes: the orientation tag used to stand images upright, and a
 * short camera summary kept with the image.
 *
 * <p>Missing or malformed metadata is not an error. Such images are taken as they are.</p>
 */
@Slf4j
@Component
public class ExifMetadataReader {

    public static final int ORIENTATION_NORMAL = 1;

    private static final int[] CAMERA_TAGS = {
        ExifIFD0Directory.TAG_MAKE,
        ExifIFD0Directory.TAG_MODEL,
        ExifIFD0Directory.TAG_DATETIME,
        ExifIFD0Directory.TAG_SOFTWARE,
        ExifIFD0Directory.TAG_ORIENTATION,
        ExifIFD0Directory.TAG_X_RESOLUTION,
        ExifIFD0Directory.TAG_Y_RESOLUTION
    };

    private static final int[] EXPOSURE_TAGS = {
        ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL,
        ExifSubIFDDirectory.TAG_EXPOSURE_TIME,
        ExifSubIFDDirectory.TAG_FNUMBER,
        ExifSubIFDDirectory.TAG_ISO_EQUIVALENT,
        ExifSubIFDDirectory.TAG_FOCAL_LENGTH,
        ExifSubIFDDirectory.TAG_FLASH,
        ExifSubIFDDirectory.TAG_WHITE_BALANCE_MODE
    };

    /**
     * EXIF orientation (1-8), or {@link #ORIENTATION_NORMAL} when the tag is absent or unreadable.
     */
    public int orientation(byte[] bytes) {
        Optional<Metadata> metadata = read(bytes);
        if (metadata.isEmpty()) {
            return ORIENTATION_NORMAL;
        }
        ExifIFD0Directory ifd0 = metadata.get().getFirstDirectoryOfType(ExifIFD0Directory.class);
        if (ifd0 == null || !ifd0.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
            return ORIENTATION_NORMAL;
        }
        try {
            int orientation = ifd0.getInt(ExifIFD0Directory.TAG_ORIENTATION);
            return orientation >= 1 && orientation <= 8 ? orientation : ORIENTATION_NORMAL;
        } catch (MetadataException e) {
            log.debug("Ignoring unreadable EXIF orientation: {}", e.getMessage());
            return ORIENTATION_NORMAL;
        }
    }

    /**
     * Human-readable camera, exposure and GPS fields keyed by EXIF tag name, in a stable order.
     */
    public Map<String, String> summarize(byte[] bytes) {
        Optional<Metadata> metadata = read(bytes);
        if (metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, String> summary = new LinkedHashMap<>();
        describe(metadata.get().getFirstDirectoryOfType(ExifIFD0Directory.class), CAMERA_TAGS, summary);
        describe(metadata.get().getFirstDirectoryOfType(ExifSubIFDDirectory.class), EXPOSURE_TAGS, summary);

        GpsDirectory gps = metadata.get().getFirstDirectoryOfType(GpsDirectory.class);
        GeoLocation location = gps == null ? null : gps.getGeoLocation();
        if (location != null && !location.isZero()) {
            summary.put("GPS Latitude", String.valueOf(location.getLatitude()));
            summary.put("GPS Longitude", String.valueOf(location.getLongitude()));
        }
        return Collections.unmodifiableMap(summary);
    }

    private static void describe(Directory directory, int[] tags, Map<String, String> summary) {
        if (directory == null) {
            return;
        }
        for (int tag : tags) {
            String description = directory.getDescription(tag);
            if (description != null && !description.isBlank()) {
                summary.put(directory.getTagName(tag), description.trim());
            }
        }
    }

    private static Optional<Metadata> read(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(ImageMetadataReader.readMetadata(new ByteArrayInputStream(bytes), bytes.length));
        } catch (ImageProcessingException | IOException e) {
            log.debug("No readable metadata in {} byte upload: {}", bytes.length, e.getMessage());
            return Optional.empty();
        }
    }
}
