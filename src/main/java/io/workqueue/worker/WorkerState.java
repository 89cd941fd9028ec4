package io.workqueue.worker;

public enum WorkerState {
    IDLE,
    CLAIMING,
    EXECUTING,
    REPORTING,
    BACKOFF,
    STOPPED
}
