package io.workqueue.executor;

import io.workqueue.config.QueueSettings;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class ExecutorRegistry {
    private static final long DEFAULT_SCRIPT_TIMEOUT_MS = 30_000L;

    private final Map<String, TaskExecutor> executors = new ConcurrentHashMap<>();

    public ExecutorRegistry register(TaskExecutor executor) {
        executors.put(executor.taskType(), executor);
        return this;
    }

    public Optional<TaskExecutor> find(String taskType) {
        return taskType == null ? Optional.empty() : Optional.ofNullable(executors.get(taskType));
    }

    public Collection<String> taskTypes() {
        return new TreeSet<>(executors.keySet());
    }

    /**
     * Registry with {@code echo}, {@code fail} and every script executor configured in
     * {@code settings}.
     */
    public static ExecutorRegistry withBuiltins(QueueSettings settings) {
        ExecutorRegistry registry = new ExecutorRegistry()
                .register(new EchoExecutor())
                .register(new FailExecutor());
        for (Map.Entry<String, QueueSettings.ScriptExecutorSpec> e : settings.scriptExecutors().entrySet()) {
            QueueSettings.ScriptExecutorSpec spec = e.getValue();
            long timeoutMs = spec.timeoutMs() == null ? DEFAULT_SCRIPT_TIMEOUT_MS : spec.timeoutMs();
            registry.register(new ScriptExecutor(e.getKey(), spec.command(), timeoutMs));
        }
        return registry;
    }
}
