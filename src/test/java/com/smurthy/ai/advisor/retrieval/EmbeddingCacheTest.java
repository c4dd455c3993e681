package com.smurthy.ai.advisor.retrieval;

import com.smurthy.ai.advisor.config.EmbeddingConfig;
import com.smurthy.ai.advisor.exceptions.EmbeddingProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingCacheTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private EmbeddingCache embeddingCache;

    @BeforeEach
    void setUp() {
        embeddingCache = new EmbeddingCache(embeddingModel, new EmbeddingConfig(5000, 2000, 2000));
    }

    @Test
    @DisplayName("Should call the provider once per distinct text")
    void testMemoizesEmbedding() {
        // Given
        float[] vector = {0.1f, 0.2f, 0.3f};
        when(embeddingModel.embed("La TVA")).thenReturn(vector);

        // When
        float[] first = embeddingCache.getOrCompute("La TVA");
        float[] second = embeddingCache.getOrCompute("La TVA");

        // Then
        assertThat(first).isSameAs(second).containsExactly(0.1f, 0.2f, 0.3f);
        verify(embeddingModel, times(1)).embed("La TVA");
        assertThat(embeddingCache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should key on the exact text, without trimming or case folding")
    void testExactTextKey() {
        when(embeddingModel.embed(anyString())).thenReturn(new float[]{1f});

        embeddingCache.getOrCompute("tva");
        embeddingCache.getOrCompute("TVA");
        embeddingCache.getOrCompute(" tva ");

        assertThat(embeddingCache.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should keep head and tail of texts over the length threshold")
    void testLongTextNormalization() {
        // Given
        String text = "a".repeat(3000) + "b".repeat(3000);

        // When
        String normalized = embeddingCache.normalize(text);

        // Then
        assertThat(normalized).hasSize(2000 + EmbeddingCache.TRUNCATION_MARKER.length() + 2000);
        assertThat(normalized).startsWith("a".repeat(2000) + EmbeddingCache.TRUNCATION_MARKER);
        assertThat(normalized).endsWith("b".repeat(2000));
        assertThat(embeddingCache.normalize("short text")).isEqualTo("short text");
    }

    @Test
    @DisplayName("Should send the normalized text to the provider")
    void testProviderReceivesNormalizedText() {
        String text = "x".repeat(6000);
        String expected = "x".repeat(2000) + EmbeddingCache.TRUNCATION_MARKER + "x".repeat(2000);
        when(embeddingModel.embed(expected)).thenReturn(new float[]{0.5f});

        assertThat(embeddingCache.getOrCompute(text)).containsExactly(0.5f);
    }

    @Test
    @DisplayName("Should wrap provider failures and cache nothing")
    void testProviderFailure() {
        when(embeddingModel.embed("boom")).thenThrow(new IllegalStateException("rate limited"));

        assertThatThrownBy(() -> embeddingCache.getOrCompute("boom"))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("rate limited");
        assertThat(embeddingCache.size()).isZero();
    }

    @Test
    @DisplayName("Should reject an empty vector")
    void testEmptyVector() {
        when(embeddingModel.embed("empty")).thenReturn(new float[0]);

        assertThatThrownBy(() -> embeddingCache.getOrCompute("empty"))
                .isInstanceOf(EmbeddingProviderException.class);
        assertThat(embeddingCache.size()).isZero();
    }

    @Test
    @DisplayName("Should share one provider call among concurrent requests for the same text")
    void testConcurrentIdenticalKeys() throws Exception {
        // Given: the provider blocks until the test releases it
        int callers = 8;
        CountDownLatch providerEntered = new CountDownLatch(1);
        CountDownLatch releaseProvider = new CountDownLatch(1);
        when(embeddingModel.embed("C'est quoi la TVA ?")).thenAnswer(inv -> {
            providerEntered.countDown();
            assertThat(releaseProvider.await(5, TimeUnit.SECONDS)).isTrue();
            return new float[]{0.1f, 0.9f};
        });

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<float[]>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return embeddingCache.getOrCompute("C'est quoi la TVA ?");
                }));
            }

            // When
            go.countDown();
            assertThat(providerEntered.await(5, TimeUnit.SECONDS)).isTrue();
            releaseProvider.countDown();

            // Then
            float[] expected = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<float[]> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(expected);
            }
            verify(embeddingModel, times(1)).embed("C'est quoi la TVA ?");
            assertThat(embeddingCache.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should ask the provider again after a failed call")
    void testRetryAfterFailure() {
        when(embeddingModel.embed("La CFE"))
                .thenThrow(new IllegalStateException("timeout"))
                .thenReturn(new float[]{1f});

        assertThatThrownBy(() -> embeddingCache.getOrCompute("La CFE"))
                .isInstanceOf(EmbeddingProviderException.class);
        assertThat(embeddingCache.getOrCompute("La CFE")).containsExactly(1f);
    }

    @Test
    @DisplayName("Should reject head and tail lengths that do not fit the threshold")
    void testInvalidConfig() {
        assertThatThrownBy(() -> new EmbeddingConfig(5000, 6000, 2000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("long-text-threshold");
        assertThatThrownBy(() -> new EmbeddingConfig(5000, 2000, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EmbeddingConfig(0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
