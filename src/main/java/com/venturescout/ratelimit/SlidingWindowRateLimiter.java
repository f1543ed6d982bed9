package com.venturescout.ratelimit;

import com.venturescout.config.Config;
import com.venturescout.core.TimeSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-source "at most N requests in any rolling window" gate. {@link #acquire} blocks until a
 * slot frees up; it never rejects.
 */
public final class SlidingWindowRateLimiter {
    private static final Logger log = LogManager.getLogger(SlidingWindowRateLimiter.class);

    private final int defaultMaxRequests;
    private final long windowMillis;
    private final Map<String, Integer> perSourceBudgets;
    private final TimeSource clock;

    private final Object lock = new Object();
    private final Map<String, Deque<Long>> history = new HashMap<>();

    public SlidingWindowRateLimiter(int maxRequests, long windowMillis) {
        this(maxRequests, windowMillis, Map.of(), TimeSource.system());
    }

    /**
     * @throws IllegalArgumentException when any budget or the window is not positive
     */
    public SlidingWindowRateLimiter(
            int maxRequests,
            long windowMillis,
            Map<String, Integer> perSourceBudgets,
            TimeSource clock
    ) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("rate limit budget must be positive: " + maxRequests);
        }
        if (windowMillis <= 0L) {
            throw new IllegalArgumentException("rate limit window must be positive: " + windowMillis);
        }
        Map<String, Integer> budgets = new HashMap<>();
        if (perSourceBudgets != null) {
            for (Map.Entry<String, Integer> e : perSourceBudgets.entrySet()) {
                String source = normalizeSource(e.getKey());
                Integer budget = e.getValue();
                if (budget == null || budget <= 0) {
                    throw new IllegalArgumentException("rate limit budget for " + source + " must be positive: " + budget);
                }
                budgets.put(source, budget);
            }
        }
        this.defaultMaxRequests = maxRequests;
        this.windowMillis = windowMillis;
        this.perSourceBudgets = Map.copyOf(budgets);
        this.clock = clock == null ? TimeSource.system() : clock;
    }

    /**
     * {@code ratelimit.max_requests}, {@code ratelimit.window_sec} and one
     * {@code ratelimit.source.<id>} entry per source with its own budget.
     */
    public static SlidingWindowRateLimiter fromConfig(Config config, TimeSource clock) {
        int maxRequests = config.getInt("ratelimit.max_requests", 20);
        long windowSec = config.getLong("ratelimit.window_sec", 60L);
        Map<String, Integer> budgets = new HashMap<>();
        for (Map.Entry<String, String> e : config.getSection("ratelimit.source").entrySet()) {
            int budget;
            try {
                budget = Integer.parseInt(e.getValue().trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("invalid rate limit budget for " + e.getKey() + ": " + e.getValue(), ex);
            }
            budgets.put(e.getKey(), budget);
        }
        return new SlidingWindowRateLimiter(maxRequests, windowSec * 1000L, budgets, clock);
    }

    /**
     * Blocks until the source has a free slot in the current window, then records the request.
     */
    public void acquire(String sourceId) throws InterruptedException {
        String source = normalizeSource(sourceId);
        int budget = budgetFor(source);
        while (true) {
            long waitMillis;
            synchronized (lock) {
                long now = clock.nowMillis();
                Deque<Long> stamps = history.computeIfAbsent(source, ignored -> new ArrayDeque<>());
                evictExpired(stamps, now);
                if (stamps.size() < budget) {
                    stamps.addLast(now);
                    return;
                }
                waitMillis = Math.max(1L, stamps.peekFirst() + windowMillis - now);
            }
            log.debug("rate limit reached source={} budget={} wait_ms={}", source, budget, waitMillis);
            clock.sleepMillis(waitMillis);
        }
    }

    /**
     * Requests recorded for the source inside the current window.
     */
    public int inWindow(String sourceId) {
        String source = normalizeSource(sourceId);
        synchronized (lock) {
            Deque<Long> stamps = history.get(source);
            if (stamps == null) {
                return 0;
            }
            evictExpired(stamps, clock.nowMillis());
            return stamps.size();
        }
    }

    public int budgetFor(String sourceId) {
        return perSourceBudgets.getOrDefault(normalizeSource(sourceId), defaultMaxRequests);
    }

    public long windowMillis() {
        return windowMillis;
    }

    private void evictExpired(Deque<Long> stamps, long now) {
        while (!stamps.isEmpty() && now - stamps.peekFirst() >= windowMillis) {
            stamps.pollFirst();
        }
    }

    private static String normalizeSource(String sourceId) {
        String source = sourceId == null ? "" : sourceId.trim().toLowerCase(Locale.ROOT);
        return source.isEmpty() ? "default" : source;
    }
}
