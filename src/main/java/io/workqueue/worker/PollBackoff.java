package io.workqueue.worker;

import io.workqueue.config.QueueSettings;

import java.time.Duration;

/**
 * Idle-poll delay. Immutable: {@link #next()} and {@link #reset()} return new values.
 *
 * <p>With the defaults the delays run 5, 7.5, 11.25, 16.875, 25.3125, 37.96875, 56.953125
 * seconds and then stay at 60.
 */
public record PollBackoff(double baseMs, double multiplier, double maxMs, double currentMs) {
    public PollBackoff {
        if (baseMs <= 0d) {
            throw new IllegalArgumentException("baseMs must be > 0");
        }
        if (multiplier < 1d) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxMs < baseMs) {
            throw new IllegalArgumentException("maxMs must be >= baseMs");
        }
    }

    public static PollBackoff initial(double baseMs, double multiplier, double maxMs) {
        return new PollBackoff(baseMs, multiplier, maxMs, baseMs);
    }

    public static PollBackoff fromSettings(QueueSettings settings) {
        return initial(settings.pollBaseMs(), settings.pollMultiplier(), settings.pollMaxMs());
    }

    public Duration delay() {
        return Duration.ofNanos(Math.round(currentMs * 1_000_000d));
    }

    public PollBackoff next() {
        return new PollBackoff(baseMs, multiplier, maxMs, Math.min(currentMs * multiplier, maxMs));
    }

    public PollBackoff reset() {
        return new PollBackoff(baseMs, multiplier, maxMs, baseMs);
    }
}
