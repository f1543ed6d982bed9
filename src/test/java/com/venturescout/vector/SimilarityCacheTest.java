package com.venturescout.vector;

import com.venturescout.core.TimeSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimilarityCacheTest {

    @Test
    void getOrCompute_shouldEncodeEachKeyOnce() {
        CountingEncoder encoder = new CountingEncoder();
        SimilarityCache cache = new SimilarityCache(encoder);

        float[] first = cache.getOrCompute("Payments infrastructure");
        float[] second = cache.getOrCompute("  payments   INFRASTRUCTURE ");

        assertArrayEquals(first, second);
        assertEquals(1, encoder.calls.get());
        assertEquals(1L, cache.stats().hits());
        assertEquals(1L, cache.stats().computations());
    }

    @Test
    void getOrCompute_shouldReturnCopies() {
        SimilarityCache cache = new SimilarityCache(new CountingEncoder());

        float[] first = cache.getOrCompute("copy me");
        first[0] = -99f;
        float[] second = cache.getOrCompute("copy me");

        assertTrue(second[0] != -99f);
    }

    @Test
    void getOrCompute_shouldShareOneComputationAcrossConcurrentCallers() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        EmbeddingClient slow = text -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new float[]{1f, 2f, 3f};
        };
        SimilarityCache cache = new SimilarityCache(slow);
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<float[]>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> cache.getOrCompute("shared key")));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            for (int i = 1; i < callers; i++) {
                futures.add(pool.submit(() -> cache.getOrCompute("shared key")));
            }
            long deadline = System.currentTimeMillis() + 5_000L;
            while (cache.stats().coalesced() < callers - 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5L);
            }
            release.countDown();

            for (Future<float[]> future : futures) {
                assertArrayEquals(new float[]{1f, 2f, 3f}, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, calls.get());
        assertEquals(callers - 1, cache.stats().coalesced());
        assertEquals(1, cache.size());
    }

    @Test
    void getOrCompute_shouldNotCacheFailures() {
        AtomicInteger calls = new AtomicInteger();
        EmbeddingClient flaky = text -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("timeout");
            }
            return new float[]{0.5f};
        };
        SimilarityCache cache = new SimilarityCache(flaky);

        EmbeddingException error = assertThrows(EmbeddingException.class, () -> cache.getOrCompute("retry me"));
        assertTrue(error.getMessage().contains("timeout"));
        assertEquals(0, cache.size());

        assertArrayEquals(new float[]{0.5f}, cache.getOrCompute("retry me"));
        assertEquals(2, calls.get());
        assertEquals(1L, cache.stats().failures());
    }

    @Test
    void getOrCompute_shouldRecomputeAfterTtl() {
        FakeTime time = new FakeTime();
        CountingEncoder encoder = new CountingEncoder();
        SimilarityCache cache = new SimilarityCache(encoder, 10, 1_000L, 2000, time);

        cache.getOrCompute("ttl key");
        time.now.set(999L);
        cache.getOrCompute("ttl key");
        assertEquals(1, encoder.calls.get());

        time.now.set(1_000L);
        cache.getOrCompute("ttl key");
        assertEquals(2, encoder.calls.get());
    }

    @Test
    void getOrCompute_shouldEvictLeastRecentlyUsed() {
        CountingEncoder encoder = new CountingEncoder();
        SimilarityCache cache = new SimilarityCache(encoder, 2, 0L, 2000, new FakeTime());

        cache.getOrCompute("a");
        cache.getOrCompute("b");
        cache.getOrCompute("a");
        cache.getOrCompute("c");
        assertEquals(3, encoder.calls.get());
        assertEquals(2, cache.size());
        assertEquals(1L, cache.stats().evictions());

        cache.getOrCompute("a");
        assertEquals(3, encoder.calls.get());
        cache.getOrCompute("b");
        assertEquals(4, encoder.calls.get());
    }

    @Test
    void normalizeKey_shouldTruncateLongText() {
        CountingEncoder encoder = new CountingEncoder();
        SimilarityCache cache = new SimilarityCache(encoder, 10, 0L, 5, new FakeTime());

        cache.getOrCompute("abcdefgh");
        cache.getOrCompute("abcdexyz");

        assertEquals("abcde", cache.normalizeKey("ABCDEFGH"));
        assertEquals(1, encoder.calls.get());
    }

    @Test
    void invalidate_shouldForceRecompute() {
        CountingEncoder encoder = new CountingEncoder();
        SimilarityCache cache = new SimilarityCache(encoder);

        cache.getOrCompute("drop me");
        cache.invalidate("DROP ME");
        cache.getOrCompute("drop me");

        assertEquals(2, encoder.calls.get());
    }

    @Test
    void constructor_shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class,
                () -> new SimilarityCache(new CountingEncoder(), 0, 1_000L, 100, new FakeTime()));
        assertThrows(IllegalArgumentException.class,
                () -> new SimilarityCache(new CountingEncoder(), 10, 1_000L, 0, new FakeTime()));
    }

    private static final class CountingEncoder implements EmbeddingClient {
        private final AtomicInteger calls = new AtomicInteger();
        private final HashingEmbeddingClient delegate = new HashingEmbeddingClient(16);

        @Override
        public float[] encode(String text) {
            calls.incrementAndGet();
            float[] vec = delegate.encode(text);
            vec[0] += 1f;
            return vec;
        }
    }

    private static final class FakeTime implements TimeSource {
        private final AtomicLong now = new AtomicLong();

        @Override
        public long nowMillis() {
            return now.get();
        }

        @Override
        public void sleepMillis(long millis) {
            now.addAndGet(millis);
        }
    }
}
