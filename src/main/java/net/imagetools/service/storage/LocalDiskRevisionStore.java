package net.imagetools.service.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.exception.StorageException;

/**
 * Revision store on the local filesystem. Writes go to a temporary file that is moved into
 * place, so a reader never sees a partially written revision.
 */
@Slf4j
public class LocalDiskRevisionStore extends AbstractRevisionStore {

    private static final String TEMP_SUFFIX = ".part";

    private final Path root;

    public LocalDiskRevisionStore(Path root, ThumbnailRenderer thumbnailRenderer, Clock clock) {
        super(thumbnailRenderer, clock);
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create storage root " + this.root, e);
        }
        log.info("Local revision store rooted at {}", this.root);
    }

    @Override
    protected void writeObject(String key, byte[] bytes, String contentType) {
        Path target = resolve(key);
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Failed to write " + key + ": " + e.getMessage(), key, e);
        }
    }

    @Override
    protected Optional<byte[]> readObject(String key) {
        try {
            return Optional.of(Files.readAllBytes(resolve(key)));
        } catch (NoSuchFileException e) {
            log.warn("Stored object not found: {}", key);
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read " + key + ": " + e.getMessage(), key, e);
        }
    }

    @Override
    protected void deleteObject(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + key + ": " + e.getMessage(), key, e);
        }
    }

    @Override
    protected int deletePrefix(String prefix) {
        Path directory = resolve(prefix);
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list " + prefix + ": " + e.getMessage(), prefix, e);
        }
        int deleted = 0;
        for (Path path : paths) {
            try {
                boolean regularFile = Files.isRegularFile(path);
                if (Files.deleteIfExists(path) && regularFile) {
                    deleted++;
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete " + path + ": " + e.getMessage(), prefix, e);
            }
        }
        return deleted;
    }

    @Override
    protected List<StoredObject> listObjects(String prefix) {
        Path directory = resolve(prefix);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<StoredObject> objects = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.filter(Files::isRegularFile)
                .filter(path -> !path.getFileName().toString().endsWith(TEMP_SUFFIX))
                .forEach(path -> objects.add(describe(path)));
        } catch (IOException e) {
            throw new StorageException("Failed to list " + prefix + ": " + e.getMessage(), prefix, e);
        }
        return objects;
    }

    @Override
    public String backendName() {
        return "local-disk";
    }

    @Override
    public void checkHealth() {
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            throw new StorageException("Storage root " + root + " is not a writable directory", root.toString(), false, null);
        }
    }

    private StoredObject describe(Path path) {
        String key = root.relativize(path).toString().replace('\\', '/');
        try {
            return new StoredObject(key, Files.getLastModifiedTime(path).toInstant(), Files.size(path));
        } catch (IOException e) {
            throw new StorageException("Failed to stat " + key + ": " + e.getMessage(), key, e);
        }
    }

    private Path resolve(String key) {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Key escapes the storage root: " + key);
        }
        return resolved;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
