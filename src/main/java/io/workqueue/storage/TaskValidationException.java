package io.workqueue.storage;

public class TaskValidationException extends IllegalArgumentException {
    public TaskValidationException(String message) {
        super(message);
    }
}
