package io.secondbrain.provider;

import io.secondbrain.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

import static io.secondbrain.testsupport.FakeEmbeddingProvider.axis;
import static io.secondbrain.testsupport.TestFixtures.DIMENSIONS;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpringAiEmbeddingProviderTest {

    private EmbeddingModel embeddingModel;
    private SpringAiEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        embeddingModel = mock(EmbeddingModel.class);
        provider = new SpringAiEmbeddingProvider(embeddingModel, TestFixtures.properties());
    }

    @Test
    void shouldCacheEmbeddingsByContent() {
        when(embeddingModel.embed("I work at TechCorp")).thenReturn(axis(DIMENSIONS, 2));

        float[] first = provider.embed("I work at TechCorp");
        first[0] = 42f;
        float[] second = provider.embed("I work at TechCorp");

        assertArrayEquals(axis(DIMENSIONS, 2), second);
        verify(embeddingModel, times(1)).embed("I work at TechCorp");
        assertEquals(1, provider.cachedCount());
    }

    @Test
    void shouldWrapModelFailures() {
        when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("503 Service Unavailable"));

        var error = assertThrows(EmbeddingUnavailableException.class, () -> provider.embed("text"));
        assertTrue(error.getMessage().contains("503"));
        assertEquals(0, provider.cachedCount());
    }

    @Test
    void shouldRejectVectorsOfWrongDimension() {
        when(embeddingModel.embed("text")).thenReturn(new float[]{1f, 0f});

        assertThrows(IllegalStateException.class, () -> provider.embed("text"));
        assertEquals(0, provider.cachedCount());
    }

    @Test
    void shouldEvictLeastRecentlyUsedEntries() {
        when(embeddingModel.embed(anyString())).thenReturn(axis(DIMENSIONS, 0));

        for (int i = 0; i < 20; i++) {
            provider.embed("text " + i);
        }

        assertEquals(16, provider.cachedCount());
    }
}
