package io.secondbrain.provider;

import io.secondbrain.config.SecondBrainProperties;
import io.secondbrain.testsupport.FakeEmbeddingProvider;
import io.secondbrain.testsupport.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static io.secondbrain.testsupport.TestFixtures.DIMENSIONS;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExternalCallExecutorTest {

    private ExecutorService executorService;
    private ExternalCallExecutor externalCalls;

    @BeforeEach
    void setUp() {
        executorService = Executors.newCachedThreadPool();
        externalCalls = TestFixtures.externalCalls(TestFixtures.properties(), executorService);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void shouldRetryTransientFailureThenSucceed() {
        var provider = new FakeEmbeddingProvider(DIMENSIONS);
        provider.failNext(2);

        float[] vector = externalCalls.embed(provider, "hello world");

        assertEquals(DIMENSIONS, vector.length);
        assertEquals(3, provider.calls());
    }

    @Test
    void shouldFailWithEmbeddingUnavailableAfterAttemptsExhausted() {
        var provider = new FakeEmbeddingProvider(DIMENSIONS);
        provider.failNext(10);

        assertThrows(EmbeddingUnavailableException.class, () -> externalCalls.embed(provider, "hello world"));
        assertEquals(3, provider.calls());
    }

    @Test
    void shouldNotRetryPermanentFailure() {
        var attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> externalCalls.execute("embedding", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("wrong dimensions");
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    void shouldTurnTimeoutsIntoExternalServiceException() {
        var properties = TestFixtures.properties().withExternal(
                new SecondBrainProperties.External(Duration.ofMillis(50), 2, Duration.ofMillis(1), 1.0));
        var slowCalls = TestFixtures.externalCalls(properties, executorService);
        var attempts = new AtomicInteger();

        var error = assertThrows(ExternalServiceException.class, () -> slowCalls.execute("extraction", () -> {
            attempts.incrementAndGet();
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }));
        assertTrue(error.getMessage().contains("timed out"));
        assertEquals(2, attempts.get());
    }

    @Test
    void shouldWrapExtractionFailure() {
        var extractor = mock(EntityExtractor.class);
        when(extractor.extract("text")).thenThrow(new ExternalServiceException("429 Too Many Requests"));

        assertThrows(ExtractionUnavailableException.class, () -> externalCalls.extract(extractor, "text"));
        verify(extractor, times(3)).extract("text");
    }

    @Test
    void shouldReturnExtractionResult() {
        var extractor = mock(EntityExtractor.class);
        when(extractor.extract("text")).thenReturn(new ExtractionResult(null, List.of("text")));

        ExtractionResult result = externalCalls.extract(extractor, "text");

        assertEquals(List.of("text"), result.keywords());
    }
}
