package io.workqueue.support;

import com.fasterxml.jackson.databind.JsonNode;
import io.workqueue.executor.TaskContext;
import io.workqueue.model.Task;
import io.workqueue.model.TaskStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Task context over an in-memory task, for running executors without a worker.
 */
public final class FixedTaskContext implements TaskContext {
    private final Task task;
    private final List<String> progress = new ArrayList<>();

    public FixedTaskContext(Task task) {
        this.task = task;
    }

    public static FixedTaskContext of(String taskType, JsonNode parameters) {
        return new FixedTaskContext(new Task(
                1L, taskType, parameters, 5, 0L, TaskStatus.RUNNING, "worker-test", 0L, 60_000L, "token",
                0, 3, null, null, null, 0L, 0L, null
        ));
    }

    @Override
    public Task task() {
        return task;
    }

    @Override
    public void checkpoint() {
    }

    @Override
    public void progress(String message, JsonNode details) {
        progress.add(message);
    }

    public List<String> progressMessages() {
        return progress;
    }
}
