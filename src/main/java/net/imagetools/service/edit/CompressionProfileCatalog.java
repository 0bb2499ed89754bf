package net.imagetools.service.edit;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.config.CompressionProperties;
import net.imagetools.model.CompressionProfile;
import net.imagetools.model.ImageFormat;
import net.imagetools.service.transform.ImageCodec;
import org.springframework.stereotype.Component;

/**
 * Compression profiles resolved from configuration once at startup.
 */
@Slf4j
@Component
public class CompressionProfileCatalog {

    private final Map<String, CompressionProfile> profiles;

    public CompressionProfileCatalog(CompressionProperties properties) {
        Map<String, CompressionProfile> resolved = new LinkedHashMap<>();
        properties.getProfiles().forEach((id, profile) -> resolved.put(normalize(id), toProfile(normalize(id), profile)));
        this.profiles = Map.copyOf(resolved);
        log.info("Loaded {} compression profiles: {}", profiles.size(), profiles.keySet());
    }

    public Optional<CompressionProfile> find(String profileId) {
        if (profileId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(normalize(profileId)));
    }

    public Collection<CompressionProfile> all() {
        return profiles.values();
    }

    private static CompressionProfile toProfile(String id, CompressionProperties.Profile profile) {
        if (profile.getMaxWidth() <= 0 || profile.getMaxHeight() <= 0) {
            throw new IllegalStateException("Compression profile " + id + " needs positive max-width and max-height");
        }
        if (profile.getQuality() < 1 || profile.getQuality() > 100) {
            throw new IllegalStateException("Compression profile " + id + " quality must be within 1-100");
        }
        ImageFormat format = ImageFormat.fromName(profile.getFormat())
            .orElseThrow(() -> new IllegalStateException(
                "Compression profile " + id + " has unknown format " + profile.getFormat()));
        if (!ImageCodec.canWrite(format)) {
            log.warn("Compression profile {} asks for {} which this runtime cannot write; PNG will be used", id, format);
        }
        String name = profile.getName() == null || profile.getName().isBlank() ? id : profile.getName();
        return new CompressionProfile(id, name, profile.getMaxWidth(), profile.getMaxHeight(),
            profile.getQuality(), Math.max(0, profile.getTargetSizeKb()), format, profile.isRetainAspectRatio());
    }

    private static String normalize(String profileId) {
        return profileId.trim().toLowerCase(Locale.ROOT);
    }
}
