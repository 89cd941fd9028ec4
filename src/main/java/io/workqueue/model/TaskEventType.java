package io.workqueue.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskEventType {
    CREATED,
    CLAIMED,
    STARTED,
    PROGRESS,
    COMPLETED,
    FAILED,
    RETRY,
    CANCELLED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskEventType fromString(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
