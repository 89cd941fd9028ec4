package io.workqueue.util;

import java.time.Duration;

/**
 * Blocking pause used by polling and lock-retry loops, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            long ms = duration.toMillis();
            if (ms > 0) {
                Thread.sleep(ms);
            }
        };
    }
}
