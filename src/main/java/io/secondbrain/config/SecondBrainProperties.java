package io.secondbrain.config;

import io.secondbrain.search.KeywordFilterMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the memory engine.
 *
 * <p>Binds to {@code secondbrain} in application.yml:</p>
 * <pre>
 * secondbrain:
 *   storage:
 *     path: ./data/secondbrain.db
 *   embedding:
 *     dimensions: 384
 *   classifier:
 *     update-threshold: 0.70
 *     extend-threshold: 0.60
 *   tiering:
 *     recency-window: 30d
 *     promotion-threshold: 5
 *   ranking:
 *     semantic-weight: 0.7
 *     half-life-days: 90
 * </pre>
 *
 * Every section is optional; missing values fall back to the defaults applied in the compact constructors.
 */
@ConfigurationProperties(prefix = "secondbrain")
public record SecondBrainProperties(
        Storage storage,
        Embedding embedding,
        External external,
        Chunking chunking,
        Classifier classifier,
        Tiering tiering,
        Ranking ranking,
        Ingestion ingestion,
        Tools tools
) {

    public SecondBrainProperties {
        if (storage == null) storage = new Storage(null, null);
        if (embedding == null) embedding = new Embedding(null, null);
        if (external == null) external = new External(null, null, null, null);
        if (chunking == null) chunking = new Chunking(null);
        if (classifier == null) classifier = new Classifier(null, null, null, null, null, null, null);
        if (tiering == null) tiering = new Tiering(null, null, null, null, null);
        if (ranking == null) ranking = new Ranking(null, null, null, null, null);
        if (ingestion == null) ingestion = new Ingestion(null, null, null);
        if (tools == null) tools = new Tools(null);
    }

    /** All defaults. */
    public static SecondBrainProperties defaults() {
        return new SecondBrainProperties(null, null, null, null, null, null, null, null, null);
    }

    public SecondBrainProperties withEmbedding(Embedding embedding) {
        return new SecondBrainProperties(storage, embedding, external, chunking, classifier, tiering, ranking, ingestion, tools);
    }

    public SecondBrainProperties withExternal(External external) {
        return new SecondBrainProperties(storage, embedding, external, chunking, classifier, tiering, ranking, ingestion, tools);
    }

    public SecondBrainProperties withClassifier(Classifier classifier) {
        return new SecondBrainProperties(storage, embedding, external, chunking, classifier, tiering, ranking, ingestion, tools);
    }

    public SecondBrainProperties withTiering(Tiering tiering) {
        return new SecondBrainProperties(storage, embedding, external, chunking, classifier, tiering, ranking, ingestion, tools);
    }

    public SecondBrainProperties withRanking(Ranking ranking) {
        return new SecondBrainProperties(storage, embedding, external, chunking, classifier, tiering, ranking, ingestion, tools);
    }

    /**
     * @param path          SQLite database file
     * @param busyTimeoutMs how long a writer waits on a locked database
     */
    public record Storage(String path, Integer busyTimeoutMs) {
        public Storage {
            if (path == null || path.isBlank()) path = "./data/secondbrain.db";
            if (busyTimeoutMs == null) busyTimeoutMs = 5000;
        }
    }

    /**
     * @param dimensions length D of every embedding vector
     * @param cacheSize  embeddings cached by content hash, 0 disables the cache
     */
    public record Embedding(Integer dimensions, Integer cacheSize) {
        public Embedding {
            if (dimensions == null) dimensions = 384;
            if (cacheSize == null) cacheSize = 1024;
            if (dimensions <= 0) throw new IllegalArgumentException("embedding dimensions must be positive");
        }
    }

    /** Timeout and retry policy for embedding and extraction calls. */
    public record External(Duration timeout, Integer maxAttempts, Duration initialBackoff, Double backoffMultiplier) {
        public External {
            if (timeout == null) timeout = Duration.ofSeconds(10);
            if (maxAttempts == null) maxAttempts = 3;
            if (initialBackoff == null) initialBackoff = Duration.ofMillis(500);
            if (backoffMultiplier == null) backoffMultiplier = 2.0;
        }
    }

    public record Chunking(Integer maxChunkSize) {
        public Chunking {
            if (maxChunkSize == null) maxChunkSize = 500;
        }
    }

    /**
     * Relationship classification thresholds.
     *
     * @param candidateCount     K nearest memories considered per new memory
     * @param similarityFloor    minimum similarity for a candidate, and for a SIMILAR edge
     * @param updateThreshold    minimum similarity for UPDATES
     * @param extendThreshold    minimum similarity for EXTENDS
     * @param overlapThreshold   minimum keyword Jaccard overlap for DERIVES
     * @param minSharedKeywords  minimum shared keywords for DERIVES
     * @param duplicateThreshold similarity at which a non-contradicting pair is a restatement
     */
    public record Classifier(
            Integer candidateCount,
            Double similarityFloor,
            Double updateThreshold,
            Double extendThreshold,
            Double overlapThreshold,
            Integer minSharedKeywords,
            Double duplicateThreshold
    ) {
        public Classifier {
            if (candidateCount == null) candidateCount = 10;
            if (similarityFloor == null) similarityFloor = 0.30;
            if (updateThreshold == null) updateThreshold = 0.70;
            if (extendThreshold == null) extendThreshold = 0.60;
            if (overlapThreshold == null) overlapThreshold = 0.30;
            if (minSharedKeywords == null) minSharedKeywords = 2;
            if (duplicateThreshold == null) duplicateThreshold = 0.95;
        }
    }

    /**
     * Hot/cold tier policy.
     *
     * @param recencyWindow            memories younger than this stay hot
     * @param promotionThreshold       access count that makes a memory hot regardless of age
     * @param rebalanceIntervalMinutes how often the demotion sweep runs
     * @param enabled                  whether the recurring sweep is registered
     * @param coldStorageEnabled       when false every memory is kept hot
     */
    public record Tiering(
            Duration recencyWindow,
            Integer promotionThreshold,
            Integer rebalanceIntervalMinutes,
            Boolean enabled,
            Boolean coldStorageEnabled
    ) {
        public Tiering {
            if (recencyWindow == null) recencyWindow = Duration.ofDays(30);
            if (promotionThreshold == null) promotionThreshold = 5;
            if (rebalanceIntervalMinutes == null) rebalanceIntervalMinutes = 60;
            if (enabled == null) enabled = true;
            if (coldStorageEnabled == null) coldStorageEnabled = true;
        }
    }

    /**
     * Search scoring.
     *
     * @param semanticWeight      weight of vector similarity against keyword match
     * @param halfLifeDays        time decay constant in days
     * @param candidateMultiplier candidates fetched per requested result
     * @param keywordFilterMode   how a keyword list narrows results
     * @param maxLimit            largest accepted result limit
     */
    public record Ranking(
            Double semanticWeight,
            Double halfLifeDays,
            Integer candidateMultiplier,
            KeywordFilterMode keywordFilterMode,
            Integer maxLimit
    ) {
        public Ranking {
            if (semanticWeight == null) semanticWeight = 0.7;
            if (halfLifeDays == null) halfLifeDays = 90.0;
            if (candidateMultiplier == null) candidateMultiplier = 5;
            if (keywordFilterMode == null) keywordFilterMode = KeywordFilterMode.BOOST;
            if (maxLimit == null) maxLimit = 100;
        }
    }

    public record Ingestion(Integer minContentLength, Integer maxContentLength, Integer maxTitleLength) {
        public Ingestion {
            if (minContentLength == null) minContentLength = 1;
            if (maxContentLength == null) maxContentLength = 1_000_000;
            if (maxTitleLength == null) maxTitleLength = 500;
        }
    }

    /** @param ownerId owner that agent tool calls read and write */
    public record Tools(String ownerId) {
        public Tools {
            if (ownerId == null || ownerId.isBlank()) ownerId = "default";
        }
    }
}
