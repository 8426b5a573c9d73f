package io.secondbrain.provider;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to external providers with a per-attempt timeout and exponential-backoff retries.
 *
 * <p>Transient failures ({@link ExternalServiceException} and timeouts) are retried until the attempts
 * are used up; the last failure is then rethrown as an {@link ExternalServiceException}. Any other
 * exception is permanent and propagates on the first attempt.</p>
 */
@Component
public class ExternalCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallExecutor.class);

    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public ExternalCallExecutor(Retry externalCallRetry, TimeLimiter externalCallTimeLimiter,
                                ExecutorService externalCallExecutorService) {
        this.retry = externalCallRetry;
        this.timeLimiter = externalCallTimeLimiter;
        this.executor = externalCallExecutorService;
    }

    /** Embeds text through the provider, failing with {@link EmbeddingUnavailableException}. */
    public float[] embed(EmbeddingProvider provider, String text) {
        try {
            return execute("embedding", () -> provider.embed(text));
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (ExternalServiceException e) {
            throw new EmbeddingUnavailableException(e.getMessage(), e);
        }
    }

    /** Extracts entities and keywords, failing with {@link ExtractionUnavailableException}. */
    public ExtractionResult extract(EntityExtractor extractor, String text) {
        try {
            return execute("extraction", () -> extractor.extract(text));
        } catch (ExtractionUnavailableException e) {
            throw e;
        } catch (ExternalServiceException e) {
            throw new ExtractionUnavailableException(e.getMessage(), e);
        }
    }

    public <T> T execute(String operation, Supplier<T> call) {
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(call, executor));
        Callable<T> retrying = Retry.decorateCallable(retry, timed);
        try {
            return retrying.call();
        } catch (ExternalServiceException e) {
            log.warn("{} failed after retries: {}", operation, e.getMessage());
            throw e;
        } catch (TimeoutException e) {
            log.warn("{} timed out after retries", operation);
            throw new ExternalServiceException(operation + " timed out", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ExternalServiceException(operation + " failed: " + e.getMessage(), e);
        }
    }
}
