package io.workqueue.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Task lifecycle states as persisted in {@code task_queue.status}.
 *
 * <p>{@link #CLAIMED} is the leased state: the row has an owner and a lease deadline
 * but execution has not started yet.
 */
public enum TaskStatus {
    QUEUED("queued"),
    CLAIMED("claimed"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String dbValue;

    TaskStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean owned() {
        return this == CLAIMED || this == RUNNING;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("leased".equals(normalized)) {
            return CLAIMED;
        }
        for (TaskStatus value : values()) {
            if (value.dbValue.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
