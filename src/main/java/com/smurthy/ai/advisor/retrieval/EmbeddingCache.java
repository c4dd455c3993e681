package com.smurthy.ai.advisor.retrieval;

import com.smurthy.ai.advisor.config.EmbeddingConfig;
import com.smurthy.ai.advisor.exceptions.EmbeddingProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide memo of embeddings, keyed by a hash of the normalised text.
 *
 * Long texts are reduced to their head and tail before embedding, so two texts sharing the same
 * head and tail share a vector. The key is the exact normalised text: no trimming or case folding.
 * Entries are never evicted. Concurrent requests for a text being embedded share the one
 * provider call.
 */
@Service
public class EmbeddingCache {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    static final String TRUNCATION_MARKER = "\n[...]\n";

    private final EmbeddingModel embeddingModel;
    private final EmbeddingConfig config;
    private final Map<String, float[]> vectors = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<float[]>> inFlight = new ConcurrentHashMap<>();

    public EmbeddingCache(EmbeddingModel embeddingModel, EmbeddingConfig config) {
        this.embeddingModel = embeddingModel;
        this.config = config;
    }

    /**
     * Return the cached embedding for {@code text}, computing it on first use.
     *
     * @throws EmbeddingProviderException when the provider fails or returns an empty vector
     */
    public float[] getOrCompute(String text) {
        String normalized = normalize(text == null ? "" : text);
        String key = keyOf(normalized);

        float[] cached = vectors.get(key);
        if (cached != null) {
            return cached;
        }

        // one provider call per key; concurrent callers for the same key wait for it
        CompletableFuture<float[]> pending = new CompletableFuture<>();
        CompletableFuture<float[]> running = inFlight.putIfAbsent(key, pending);
        if (running != null) {
            return await(running);
        }

        try {
            float[] vector = vectors.get(key);
            if (vector == null) {
                vector = embed(normalized);
                vectors.put(key, vector);
                log.debug("Embedding cached ({} chars, {} entries)", normalized.length(), vectors.size());
            }
            pending.complete(vector);
            return vector;
        } catch (EmbeddingProviderException e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, pending);
        }
    }

    /**
     * Keep the first and last characters of over-long text, joined by a marker.
     */
    String normalize(String text) {
        if (text.length() <= config.longTextThreshold()) {
            return text;
        }
        return text.substring(0, config.headChars())
                + TRUNCATION_MARKER
                + text.substring(text.length() - config.tailChars());
    }

    public int size() {
        return vectors.size();
    }

    public void clear() {
        vectors.clear();
    }

    private float[] embed(String normalized) {
        float[] vector;
        try {
            vector = embeddingModel.embed(normalized);
        } catch (RuntimeException e) {
            throw new EmbeddingProviderException("Embedding provider failed: " + e.getMessage(), e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingProviderException("Embedding provider returned an empty vector");
        }
        return vector;
    }

    private static float[] await(CompletableFuture<float[]> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof EmbeddingProviderException providerFailure) {
                throw providerFailure;
            }
            throw new EmbeddingProviderException("Embedding provider failed: " + e.getMessage(), e);
        }
    }

    private static String keyOf(String normalized) {
        return DigestUtils.md5DigestAsHex(normalized.getBytes(StandardCharsets.UTF_8));
    }
}
