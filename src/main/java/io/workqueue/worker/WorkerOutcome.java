package io.workqueue.worker;

/**
 * Result of one poll cycle.
 */
public record WorkerOutcome(boolean claimed, Long taskId, Kind kind, String message) {
    public static WorkerOutcome idle() {
        return new WorkerOutcome(false, null, Kind.IDLE, "No eligible tasks");
    }

    public static WorkerOutcome of(long taskId, Kind kind, String message) {
        return new WorkerOutcome(true, taskId, kind, message);
    }

    public enum Kind {
        IDLE,
        COMPLETED,
        REQUEUED,
        DEAD_LETTERED,
        CANCELLED,
        LEASE_LOST
    }
}
