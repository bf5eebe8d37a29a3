package github.sarthakdev143.film_factory.model;

/**
 * @param sourceUrl where the provider published the artifact, {@code null} when it was returned inline
 */
public record GeneratedArtifact(byte[] content, String contentType, String sourceUrl) {

    public GeneratedArtifact(byte[] content, String contentType) {
        this(content, contentType, null);
    }
}
