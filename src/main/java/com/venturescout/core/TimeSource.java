package com.venturescout.core;

/**
 * Clock and sleep used by time-dependent components, replaceable in tests.
 */
public interface TimeSource {
    long nowMillis();

    void sleepMillis(long millis) throws InterruptedException;

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    final class SystemTimeSource implements TimeSource {
        private static final SystemTimeSource INSTANCE = new SystemTimeSource();

        private SystemTimeSource() {
        }

        @Override
        public long nowMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleepMillis(long millis) throws InterruptedException {
            if (millis > 0L) {
                Thread.sleep(millis);
            }
        }
    }
}
