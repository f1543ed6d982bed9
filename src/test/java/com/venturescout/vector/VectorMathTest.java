package com.venturescout.vector;

import com.venturescout.config.Config;
import com.venturescout.ratelimit.SlidingWindowRateLimiter;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorMathTest {

    @Test
    void cosine_shouldHandleDegenerateVectors() {
        assertEquals(1.0, VectorMath.cosine(new float[]{1f, 2f}, new float[]{2f, 4f}), 1e-9);
        assertEquals(0.0, VectorMath.cosine(new float[]{1f, 0f}, new float[]{0f, 1f}), 1e-9);
        assertEquals(0.0, VectorMath.cosine(new float[]{1f}, new float[]{1f, 1f}), 1e-9);
        assertEquals(0.0, VectorMath.cosine(new float[]{0f, 0f}, new float[]{1f, 1f}), 1e-9);
        assertEquals(0.0, VectorMath.similarityScore(new float[]{1f, 0f}, new float[]{-1f, 0f}), 1e-9);
    }

    @Test
    void textSimilarity_shouldBeSymmetricAndBounded() {
        TextSimilarity similarity = new TextSimilarity(new SimilarityCache(new HashingEmbeddingClient()));
        String a = "Payments infrastructure for fintech";
        String b = "Fintech payments platform";

        double ab = similarity.score(a, b);
        double ba = similarity.score(b, a);

        assertEquals(ab, ba, 1e-9);
        assertTrue(ab > 0.0 && ab <= 100.0);
        assertEquals(100.0, similarity.score(a, a), 1e-6);
        assertEquals(0.0, similarity.score(a, "   "), 1e-9);
    }

    @Test
    void embeddingClients_shouldPickProviderFromConfig() {
        Config config = Config.fromConfigurationProperties(null, Map.of(
                "embedding", Map.of("provider", "ollama"),
                "cache", Map.of("capacity", "5")
        ));
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(5, 1_000L);

        EmbeddingClient ollama = EmbeddingClients.fromConfig(config, limiter);
        EmbeddingClient fallback = EmbeddingClients.create("word2vec", config, limiter);
        SimilarityCache cache = EmbeddingClients.cacheFromConfig(config, fallback);

        assertTrue(ollama instanceof OllamaEmbeddingClient);
        assertEquals("hashing-384", fallback.name());
        assertEquals("hashing-384", cache.encoderName());
    }
}
