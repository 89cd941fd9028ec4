package io.workqueue.claim;

import io.workqueue.storage.TaskStore;

import java.util.Locale;
import java.util.Random;

public enum ClaimStrategyType {
    FIFO,
    LIFO,
    PRIORITY,
    WEIGHTED_RANDOM;

    public static ClaimStrategyType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return LIFO;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("WEIGHTED".equals(normalized) || "RANDOM".equals(normalized)) {
            return WEIGHTED_RANDOM;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown claim strategy: " + raw
                    + " (expected FIFO, LIFO, PRIORITY or WEIGHTED_RANDOM)");
        }
    }

    public ClaimStrategy create(TaskStore store, Random random) {
        return switch (this) {
            case FIFO -> new FifoClaimStrategy(store);
            case LIFO -> new LifoClaimStrategy(store);
            case PRIORITY -> new PriorityClaimStrategy(store);
            case WEIGHTED_RANDOM -> new WeightedRandomClaimStrategy(store, random);
        };
    }
}
