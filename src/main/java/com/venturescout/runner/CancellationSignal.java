package com.venturescout.runner;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request for a running batch. Once cancelled it stays cancelled.
 */
public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
