package io.workqueue.executor;

/**
 * Runs tasks of one {@code task_type}.
 *
 * <p>Throwing {@link NonRetryableTaskException} dead-letters the task; any other exception is
 * treated as retryable. Long-running executors should call {@link TaskContext#checkpoint()}
 * between units of work so cancellation and lease loss stop them early.
 */
public interface TaskExecutor {
    String taskType();

    ExecutionResult execute(TaskContext context) throws Exception;
}
