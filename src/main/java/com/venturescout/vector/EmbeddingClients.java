package com.venturescout.vector;

import com.venturescout.config.Config;
import com.venturescout.data.http.HttpClientEx;
import com.venturescout.ratelimit.SlidingWindowRateLimiter;

import java.util.Locale;

public final class EmbeddingClients {
    private EmbeddingClients() {
    }

    /**
     * {@code embedding.provider=ollama} gives a rate-limited HTTP client, anything else the
     * offline hashing encoder.
     */
    public static EmbeddingClient fromConfig(Config config, SlidingWindowRateLimiter rateLimiter) {
        return create(config.getString("embedding.provider", "hashing"), config, rateLimiter);
    }

    public static EmbeddingClient create(String providerName, Config config, SlidingWindowRateLimiter rateLimiter) {
        String provider = providerName == null ? "hashing" : providerName.trim().toLowerCase(Locale.ROOT);
        if ("ollama".equals(provider)) {
            return OllamaEmbeddingClient.fromConfig(config, new HttpClientEx(rateLimiter));
        }
        if (!"hashing".equals(provider)) {
            System.err.println("WARN: unknown embedding.provider=" + provider + ", using hashing");
        }
        return new HashingEmbeddingClient(Math.max(8, config.getInt("embedding.dimension", HashingEmbeddingClient.DEFAULT_DIMENSION)));
    }

    public static SimilarityCache cacheFromConfig(Config config, EmbeddingClient encoder) {
        return new SimilarityCache(
                encoder,
                Math.max(1, config.getInt("cache.capacity", SimilarityCache.DEFAULT_CAPACITY)),
                config.getLong("cache.ttl_sec", SimilarityCache.DEFAULT_TTL_MILLIS / 1000L) * 1000L,
                Math.max(1, config.getInt("cache.max_chars", SimilarityCache.DEFAULT_MAX_CHARS)),
                null
        );
    }
}
