package io.workqueue.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.workqueue.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Effective queue settings. Loaded from {@code workqueue-settings.json}; any field the file
 * omits keeps its default.
 */
public record QueueSettings(
        long leaseTimeoutMs,
        long heartbeatIntervalMs,
        long staleWorkerAfterMs,
        long pollBaseMs,
        double pollMultiplier,
        long pollMaxMs,
        int defaultPriority,
        int minPriority,
        int maxPriority,
        int defaultMaxRetries,
        long retryBaseDelayMs,
        long retryMaxDelayMs,
        int busyTimeoutMs,
        int lockRetryAttempts,
        long lockRetryBaseMs,
        long lockRetryMaxMs,
        int cacheSize,
        int walAutocheckpointPages,
        long sweepIntervalMs,
        int sweepBatchLimit,
        int recommendedMaxWorkers,
        Map<String, ScriptExecutorSpec> scriptExecutors
) {
    public static final int PRIORITY_FLOOR = 1;
    public static final int PRIORITY_CEILING = 10;
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_POLL_BASE_MS = 5_000L;
    public static final double DEFAULT_POLL_MULTIPLIER = 1.5d;
    public static final long DEFAULT_POLL_MAX_MS = 60_000L;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public QueueSettings {
        scriptExecutors = scriptExecutors == null ? Map.of() : Map.copyOf(scriptExecutors);
    }

    public static QueueSettings defaults() {
        return new QueueSettings(
                DEFAULT_LEASE_TIMEOUT_MS,
                DEFAULT_HEARTBEAT_INTERVAL_MS,
                180_000L,
                DEFAULT_POLL_BASE_MS,
                DEFAULT_POLL_MULTIPLIER,
                DEFAULT_POLL_MAX_MS,
                5,
                PRIORITY_FLOOR,
                PRIORITY_CEILING,
                DEFAULT_MAX_RETRIES,
                0L,
                60_000L,
                5_000,
                5,
                50L,
                1_000L,
                -10_000,
                1_000,
                30_000L,
                100,
                6,
                Map.of()
        );
    }

    public static QueueSettings load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    public static QueueSettings parse(String json) {
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            return fromFile(Jsons.mapper().readValue(json, SettingsFile.class), defaults());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings JSON", e);
        }
    }

    static QueueSettings fromFile(SettingsFile file, QueueSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int minPriority = clampInt(pick(file.minPriority(), defaults.minPriority()), PRIORITY_FLOOR, PRIORITY_CEILING);
        int maxPriority = clampInt(pick(file.maxPriority(), defaults.maxPriority()), minPriority, PRIORITY_CEILING);
        long leaseTimeoutMs = Math.max(100L, pick(file.leaseTimeoutMs(), defaults.leaseTimeoutMs()));
        long heartbeatMs = Math.max(10L, pick(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs()));
        if (heartbeatMs >= leaseTimeoutMs) {
            // a heartbeat must land before the lease it renews runs out
            heartbeatMs = Math.max(10L, leaseTimeoutMs / 3L);
        }
        long pollBaseMs = Math.max(1L, pick(file.pollBaseMs(), defaults.pollBaseMs()));
        Map<String, ScriptExecutorSpec> scripts = new LinkedHashMap<>(defaults.scriptExecutors());
        if (file.scriptExecutors() != null) {
            scripts.putAll(file.scriptExecutors());
        }
        return new QueueSettings(
                leaseTimeoutMs,
                heartbeatMs,
                Math.max(heartbeatMs, pick(file.staleWorkerAfterMs(), defaults.staleWorkerAfterMs())),
                pollBaseMs,
                Math.max(1.0d, pick(file.pollMultiplier(), defaults.pollMultiplier())),
                Math.max(pollBaseMs, pick(file.pollMaxMs(), defaults.pollMaxMs())),
                clampInt(pick(file.defaultPriority(), defaults.defaultPriority()), minPriority, maxPriority),
                minPriority,
                maxPriority,
                Math.max(0, pick(file.defaultMaxRetries(), defaults.defaultMaxRetries())),
                Math.max(0L, pick(file.retryBaseDelayMs(), defaults.retryBaseDelayMs())),
                Math.max(0L, pick(file.retryMaxDelayMs(), defaults.retryMaxDelayMs())),
                Math.max(0, pick(file.busyTimeoutMs(), defaults.busyTimeoutMs())),
                Math.max(1, pick(file.lockRetryAttempts(), defaults.lockRetryAttempts())),
                Math.max(1L, pick(file.lockRetryBaseMs(), defaults.lockRetryBaseMs())),
                Math.max(1L, pick(file.lockRetryMaxMs(), defaults.lockRetryMaxMs())),
                pick(file.cacheSize(), defaults.cacheSize()),
                Math.max(0, pick(file.walAutocheckpointPages(), defaults.walAutocheckpointPages())),
                Math.max(10L, pick(file.sweepIntervalMs(), defaults.sweepIntervalMs())),
                Math.max(1, pick(file.sweepBatchLimit(), defaults.sweepBatchLimit())),
                Math.max(1, pick(file.recommendedMaxWorkers(), defaults.recommendedMaxWorkers())),
                scripts
        );
    }

    /**
     * Applies worker-level overrides (null keeps the current value) with the same clamping as
     * the settings file.
     */
    public QueueSettings withWorkerOverrides(Long leaseTimeoutMs, Long heartbeatIntervalMs, Long pollBaseMs, Long pollMaxMs) {
        SettingsFile overrides = new SettingsFile(
                leaseTimeoutMs, heartbeatIntervalMs, null, pollBaseMs, null, pollMaxMs,
                null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null
        );
        return fromFile(overrides, this);
    }

    public Duration leaseTimeout() {
        return Duration.ofMillis(leaseTimeoutMs);
    }

    private static <T> T pick(T value, T fallback) {
        return value == null ? fallback : value;
    }

    private static int clampInt(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public record ScriptExecutorSpec(List<String> command, Long timeoutMs) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long leaseTimeoutMs,
            Long heartbeatIntervalMs,
            Long staleWorkerAfterMs,
            Long pollBaseMs,
            Double pollMultiplier,
            Long pollMaxMs,
            Integer defaultPriority,
            Integer minPriority,
            Integer maxPriority,
            Integer defaultMaxRetries,
            Long retryBaseDelayMs,
            Long retryMaxDelayMs,
            Integer busyTimeoutMs,
            Integer lockRetryAttempts,
            Long lockRetryBaseMs,
            Long lockRetryMaxMs,
            Integer cacheSize,
            Integer walAutocheckpointPages,
            Long sweepIntervalMs,
            Integer sweepBatchLimit,
            Integer recommendedMaxWorkers,
            Map<String, ScriptExecutorSpec> scriptExecutors
    ) {
    }
}
