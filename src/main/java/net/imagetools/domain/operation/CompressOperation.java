package net.imagetools.domain.operation;

import java.util.LinkedHashMap;
import java.util.Map;
import net.imagetools.exception.ValidationException;
import net.imagetools.model.CompressionProfile;

/**
 * Compress with a named profile.
 *
 * <p>Requests carry only {@code profileId}. The executor records the operation with
 * {@code resolvedProfile} filled in, so the history entry keeps the exact parameters
 * even if the profile is edited later.</p>
 */
public record CompressOperation(String profileId, CompressionProfile resolvedProfile) implements ImageOperation {

    public CompressOperation {
        if (profileId == null || profileId.isBlank()) {
            throw new ValidationException("profileId", "Compression profile id is required");
        }
        profileId = profileId.trim();
    }

    public static CompressOperation withProfile(String profileId) {
        return new CompressOperation(profileId, null);
    }

    public CompressOperation resolvedWith(CompressionProfile profile) {
        return new CompressOperation(profileId, profile);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.COMPRESS;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("profileId", profileId);
        if (resolvedProfile != null) {
            parameters.put("maxWidth", resolvedProfile.maxWidth());
            parameters.put("maxHeight", resolvedProfile.maxHeight());
            parameters.put("quality", resolvedProfile.quality());
            parameters.put("targetSizeKb", resolvedProfile.targetSizeKb());
            parameters.put("format", resolvedProfile.format().name());
        }
        return parameters;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCompress(this);
    }
}
