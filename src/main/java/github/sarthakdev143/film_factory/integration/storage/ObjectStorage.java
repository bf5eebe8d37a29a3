package github.sarthakdev143.film_factory.integration.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Durable home for generated artifacts. Refs returned here are what jobs and films persist.
 */
public interface ObjectStorage {

    String upload(String keyPrefix, byte[] content, String contentType) throws IOException;

    String uploadFile(String keyPrefix, Path source, String contentType) throws IOException;

    /**
     * Local file backing {@code ref}, for tools that need a path.
     */
    Path resolve(String ref);
}
