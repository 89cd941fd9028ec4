package io.workqueue.executor;

/**
 * Execution failure that retrying cannot fix, such as malformed parameters.
 */
public class NonRetryableTaskException extends RuntimeException {
    public NonRetryableTaskException(String message) {
        super(message);
    }

    public NonRetryableTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
