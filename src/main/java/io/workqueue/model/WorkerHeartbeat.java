package io.workqueue.model;

public record WorkerHeartbeat(
        String workerId,
        long lastHeartbeatMs,
        int tasksProcessed,
        int tasksFailed,
        Long currentTaskId,
        String strategy,
        String status,
        long startedAtMs,
        long updatedAtMs
) {
    public static final String ACTIVE = "active";
    public static final String STALE = "stale";
    public static final String STOPPED = "stopped";
}
