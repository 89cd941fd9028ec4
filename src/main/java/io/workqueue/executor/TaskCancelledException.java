package io.workqueue.executor;

public class TaskCancelledException extends RuntimeException {
    private final long taskId;
    private final Reason reason;

    public TaskCancelledException(long taskId, Reason reason) {
        super("Task " + taskId + " stopped: " + reason.name().toLowerCase());
        this.taskId = taskId;
        this.reason = reason;
    }

    public long taskId() {
        return taskId;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        CANCELLED,
        LEASE_LOST
    }
}
