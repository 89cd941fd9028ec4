package io.workqueue.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.workqueue.executor.TaskCancelledException;
import io.workqueue.executor.TaskContext;
import io.workqueue.model.Lease;
import io.workqueue.model.Task;
import io.workqueue.storage.TaskStore;

/**
 * Context handed to an executor. The worker thread flips {@link #abort} when a heartbeat finds
 * the task cancelled or the lease gone; the executor sees it at its next checkpoint.
 */
final class WorkerTaskContext implements TaskContext {
    private final Task task;
    private final Lease lease;
    private final TaskStore store;
    private volatile TaskCancelledException.Reason abortReason;

    WorkerTaskContext(Task task, Lease lease, TaskStore store) {
        this.task = task;
        this.lease = lease;
        this.store = store;
    }

    @Override
    public Task task() {
        return task;
    }

    @Override
    public void checkpoint() {
        TaskCancelledException.Reason reason = abortReason;
        if (reason != null) {
            throw new TaskCancelledException(task.id(), reason);
        }
    }

    @Override
    public void progress(String message, JsonNode details) {
        checkpoint();
        store.logProgress(lease, message, details);
    }

    void abort(TaskCancelledException.Reason reason) {
        this.abortReason = reason;
    }

    TaskCancelledException.Reason abortReason() {
        return abortReason;
    }
}
