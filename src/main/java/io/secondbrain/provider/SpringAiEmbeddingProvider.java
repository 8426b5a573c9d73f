package io.secondbrain.provider;

import io.secondbrain.config.SecondBrainProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedding provider backed by the configured Spring AI {@link EmbeddingModel}.
 * Vectors are cached by content hash, since the model is deterministic for identical input.
 */
@Component
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;
    private final int dimensions;
    private final Map<String, float[]> cache;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel, SecondBrainProperties properties) {
        this.embeddingModel = embeddingModel;
        this.dimensions = properties.embedding().dimensions();
        int cacheSize = properties.embedding().cacheSize();
        this.cache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
                return size() > cacheSize;
            }
        });
    }

    @Override
    public float[] embed(String text) {
        String key = DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
        float[] cached = cache.get(key);
        if (cached != null) {
            return cached.clone();
        }

        float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            log.warn("Embedding request failed: {}", e.getMessage());
            throw new EmbeddingUnavailableException("Embedding provider failed: " + e.getMessage(), e);
        }

        if (vector == null || vector.length != dimensions) {
            throw new IllegalStateException("Embedding model returned %d dimensions, expected %d"
                    .formatted(vector == null ? 0 : vector.length, dimensions));
        }
        cache.put(key, vector.clone());
        return vector;
    }

    int cachedCount() {
        return cache.size();
    }
}
