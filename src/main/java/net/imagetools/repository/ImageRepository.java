package net.imagetools.repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import net.imagetools.model.Image;
import org.springframework.stereotype.Repository;

/**
 * In-memory arena of image records keyed by id.
 *
 * <p>Records are immutable, so {@link #save} is the pointer swap: readers see either the
 * previous record or the new one, never a mix.</p>
 */
@Repository
public class ImageRepository {

    private final Map<String, Image> images = new ConcurrentHashMap<>();

    public Image save(Image image) {
        images.put(image.id(), image);
        return image;
    }

    public Optional<Image> findById(String imageId) {
        return Optional.ofNullable(images.get(imageId));
    }

    public List<Image> findBySessionId(String sessionId) {
        return images.values().stream()
            .filter(image -> image.sessionId().equals(sessionId))
            .sorted(Comparator.comparing(Image::createdAt).thenComparing(Image::id))
            .toList();
    }

    public long countBySessionId(String sessionId) {
        return images.values().stream()
            .filter(image -> image.sessionId().equals(sessionId))
            .count();
    }

    public List<Image> findAll() {
        return List.copyOf(images.values());
    }

    public boolean delete(String imageId) {
        return images.remove(imageId) != null;
    }
}
