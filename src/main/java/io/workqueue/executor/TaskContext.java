package io.workqueue.executor;

import com.fasterxml.jackson.databind.JsonNode;
import io.workqueue.model.Task;

public interface TaskContext {
    Task task();

    default JsonNode parameters() {
        return task().parameters();
    }

    /**
     * Throws {@link TaskCancelledException} once the task was cancelled or its lease was lost.
     */
    void checkpoint();

    void progress(String message, JsonNode details);

    default void progress(String message) {
        progress(message, null);
    }
}
