package com.venturescout.vector;

import com.venturescout.core.TimeSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizes text encodings with LRU eviction and an optional TTL.
 * <p>
 * Misses are single-flight: while one caller is encoding a key, later callers for the same key
 * wait on the same future instead of calling the encoder again. The storage lock is never held
 * across an encoder call. A failed encoding stores nothing, so the next request retries.
 */
public final class SimilarityCache {
    private static final Logger log = LogManager.getLogger(SimilarityCache.class);

    public static final int DEFAULT_CAPACITY = 1000;
    public static final long DEFAULT_TTL_MILLIS = 3_600_000L;
    public static final int DEFAULT_MAX_CHARS = 2000;

    private final EmbeddingClient encoder;
    private final int capacity;
    private final long ttlMillis;
    private final int maxChars;
    private final TimeSource clock;

    private final Object lock = new Object();
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(64, 0.75f, true);
    private final ConcurrentHashMap<String, CompletableFuture<float[]>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong computations = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public SimilarityCache(EmbeddingClient encoder) {
        this(encoder, DEFAULT_CAPACITY, DEFAULT_TTL_MILLIS, DEFAULT_MAX_CHARS, TimeSource.system());
    }

    /**
     * @param ttlMillis entry lifetime; zero or negative disables expiry
     */
    public SimilarityCache(EmbeddingClient encoder, int capacity, long ttlMillis, int maxChars, TimeSource clock) {
        if (encoder == null) {
            throw new IllegalArgumentException("encoder is required");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("cache capacity must be positive: " + capacity);
        }
        if (maxChars <= 0) {
            throw new IllegalArgumentException("cache max chars must be positive: " + maxChars);
        }
        this.encoder = encoder;
        this.capacity = capacity;
        this.ttlMillis = ttlMillis;
        this.maxChars = maxChars;
        this.clock = clock == null ? TimeSource.system() : clock;
    }

    /**
     * Vector for the text, computed at most once per live key. The returned array is a copy.
     *
     * @throws EmbeddingException when the encoder fails for this key
     */
    public float[] getOrCompute(String text) {
        String key = normalizeKey(text);
        if (key.isEmpty()) {
            return new float[0];
        }

        float[] cached = lookup(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached.clone();
        }
        misses.incrementAndGet();

        CompletableFuture<float[]> mine = new CompletableFuture<>();
        CompletableFuture<float[]> pending = inFlight.putIfAbsent(key, mine);
        if (pending != null) {
            coalesced.incrementAndGet();
            return await(key, pending).clone();
        }

        try {
            // A flight for this key may have finished between the lookup and putIfAbsent.
            float[] stored = lookup(key);
            if (stored != null) {
                mine.complete(stored);
                return stored.clone();
            }
            computations.incrementAndGet();
            float[] vector = encoder.encode(key);
            if (vector == null) {
                throw new EmbeddingException("encoder " + encoder.name() + " returned no vector");
            }
            float[] owned = vector.clone();
            store(key, owned);
            mine.complete(owned);
            return owned.clone();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            EmbeddingException failure = e instanceof EmbeddingException
                    ? (EmbeddingException) e
                    : new EmbeddingException("encoding failed: " + e.getMessage(), e);
            mine.completeExceptionally(failure);
            log.warn("embedding failed encoder={} key_chars={} err={}", encoder.name(), key.length(), e.getMessage());
            throw failure;
        } catch (Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public void invalidate(String text) {
        String key = normalizeKey(text);
        if (key.isEmpty()) {
            return;
        }
        synchronized (lock) {
            entries.remove(key);
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public CacheStats stats() {
        return new CacheStats(
                hits.get(),
                misses.get(),
                computations.get(),
                coalesced.get(),
                evictions.get(),
                failures.get(),
                size()
        );
    }

    public String encoderName() {
        return encoder.name();
    }

    /**
     * Lower-case, whitespace-collapsed, truncated form used as the cache key and as the text sent
     * to the encoder.
     */
    public String normalizeKey(String text) {
        if (text == null) {
            return "";
        }
        String key = text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        if (key.length() > maxChars) {
            key = key.substring(0, maxChars).trim();
        }
        return key;
    }

    private float[] lookup(String key) {
        synchronized (lock) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (isExpired(entry)) {
                entries.remove(key);
                return null;
            }
            return entry.vector;
        }
    }

    private void store(String key, float[] vector) {
        synchronized (lock) {
            entries.put(key, new Entry(vector, clock.nowMillis()));
            Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
            while (entries.size() > capacity && it.hasNext()) {
                Map.Entry<String, Entry> eldest = it.next();
                it.remove();
                evictions.incrementAndGet();
                log.debug("cache evicted key_chars={}", eldest.getKey().length());
            }
        }
    }

    private boolean isExpired(Entry entry) {
        return ttlMillis > 0L && clock.nowMillis() - entry.storedAtMillis >= ttlMillis;
    }

    private float[] await(String key, CompletableFuture<float[]> pending) {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("interrupted while waiting for shared encoding of key_chars=" + key.length(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new EmbeddingException("shared encoding failed: " + cause.getMessage(), cause);
        }
    }

    private static final class Entry {
        private final float[] vector;
        private final long storedAtMillis;

        private Entry(float[] vector, long storedAtMillis) {
            this.vector = vector;
            this.storedAtMillis = storedAtMillis;
        }
    }

    public record CacheStats(
            long hits,
            long misses,
            long computations,
            long coalesced,
            long evictions,
            long failures,
            int size
    ) {
        public double hitRate() {
            long lookups = hits + misses;
            return lookups == 0L ? 0.0 : (double) hits / lookups;
        }
    }
}
