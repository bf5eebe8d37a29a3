package github.sarthakdev143.film_factory.integration.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/**
 * Stores artifacts on the local disk and hands out refs under a public base url.
 */
public class LocalObjectStorage implements ObjectStorage {

    private static final Logger logger = LoggerFactory.getLogger(LocalObjectStorage.class);

    private final Path root;
    private final String publicBaseUrl;

    public LocalObjectStorage(Path root, String publicBaseUrl) {
        this.root = root.toAbsolutePath().normalize();
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl);
    }

    @Override
    public String upload(String keyPrefix, byte[] content, String contentType) throws IOException {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Refusing to store an empty artifact.");
        }
        Path target = newTarget(keyPrefix, contentType);
        Files.write(target, content);
        logger.debug("Stored artifact path={} bytes={}", target, content.length);
        return refFor(target);
    }

    @Override
    public String uploadFile(String keyPrefix, Path source, String contentType) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new IOException("Artifact source not found: " + source);
        }
        Path target = newTarget(keyPrefix, contentType);
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        return refFor(target);
    }

    @Override
    public Path resolve(String ref) {
        if (ref == null || !ref.startsWith(publicBaseUrl + "/")) {
            throw new IllegalArgumentException("Not a stored artifact ref: " + ref);
        }
        Path resolved = root.resolve(ref.substring(publicBaseUrl.length() + 1)).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Artifact ref escapes the storage root: " + ref);
        }
        return resolved;
    }

    private Path newTarget(String keyPrefix, String contentType) throws IOException {
        String prefix = keyPrefix == null || keyPrefix.isBlank() ? "misc" : keyPrefix.replaceAll("[^A-Za-z0-9_-]", "_");
        Path directory = root.resolve(prefix);
        Files.createDirectories(directory);
        return directory.resolve(UUID.randomUUID() + extensionFor(contentType));
    }

    private String refFor(Path stored) {
        return publicBaseUrl + "/" + root.relativize(stored).toString().replace('\\', '/');
    }

    static String extensionFor(String contentType) {
        if (contentType == null) {
            return ".bin";
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("mp4")) {
            return ".mp4";
        }
        if (normalized.contains("png")) {
            return ".png";
        }
        if (normalized.contains("jpeg") || normalized.contains("jpg")) {
            return ".jpg";
        }
        if (normalized.contains("webp")) {
            return ".webp";
        }
        return ".bin";
    }

    private static String stripTrailingSlash(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
