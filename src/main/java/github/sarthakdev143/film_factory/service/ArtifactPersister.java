package github.sarthakdev143.film_factory.service;

import github.sarthakdev143.film_factory.integration.provider.ArtifactFetcher;
import github.sarthakdev143.film_factory.integration.storage.ObjectStorage;
import github.sarthakdev143.film_factory.model.GeneratedArtifact;
import github.sarthakdev143.film_factory.retry.ErrorKind;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import github.sarthakdev143.film_factory.retry.RetryExecutor;
import github.sarthakdev143.film_factory.retry.RetryPolicy;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies provider outputs into our own storage and builds the completed-job result. Normal
 * completion and restart recovery both go through here so their results look the same.
 */
public class ArtifactPersister {

    public static final String ARTIFACT_REF = "artifact_ref";
    public static final String SOURCE_URL = "source_url";
    public static final String CONTENT_TYPE = "content_type";

    private final ArtifactFetcher fetcher;
    private final ObjectStorage storage;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy downloadPolicy;

    public ArtifactPersister(
            ArtifactFetcher fetcher,
            ObjectStorage storage,
            RetryExecutor retryExecutor,
            RetryPolicy downloadPolicy) {
        this.fetcher = fetcher;
        this.storage = storage;
        this.retryExecutor = retryExecutor;
        this.downloadPolicy = downloadPolicy;
    }

    public Map<String, Object> persistFromUrl(String keyPrefix, String outputUrl) {
        GeneratedArtifact artifact = retryExecutor.run("download " + keyPrefix, () -> fetcher.fetch(outputUrl), downloadPolicy);
        return store(keyPrefix, artifact);
    }

    public Map<String, Object> store(String keyPrefix, GeneratedArtifact artifact) {
        String ref;
        try {
            ref = storage.upload(keyPrefix, artifact.content(), artifact.contentType());
        } catch (IOException e) {
            throw new ProviderCallException("Could not store " + keyPrefix + " artifact: " + e.getMessage(),
                    ErrorKind.TRANSIENT, 0, e);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ARTIFACT_REF, ref);
        result.put(CONTENT_TYPE, artifact.contentType());
        if (artifact.sourceUrl() != null) {
            result.put(SOURCE_URL, artifact.sourceUrl());
        }
        return result;
    }
}
