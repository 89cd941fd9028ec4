package io.workqueue.storage;

/**
 * Storage failure that the queue could not absorb, including lock contention that outlived
 * the bounded retry.
 */
public class QueueStoreException extends RuntimeException {
    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
