package com.flow.asyncqueue.core;

import java.time.Duration;

/**
 * Exception raised (or used to complete a future exceptionally) when a queue
 * operation cannot complete.
 */
public class AsyncQueueException extends RuntimeException {

    private final String queueName;
    private final QueueErrorCode errorCode;

    public AsyncQueueException(String message, String queueName, QueueErrorCode errorCode) {
        super(message);
        this.queueName = queueName;
        this.errorCode = errorCode;
    }

    public static AsyncQueueException closed(String queueName) {
        return new AsyncQueueException("Queue '" + queueName + "' is closed", queueName, QueueErrorCode.CLOSED);
    }

    public static AsyncQueueException empty(String queueName) {
        return new AsyncQueueException("Queue '" + queueName + "' is empty", queueName, QueueErrorCode.EMPTY_QUEUE);
    }

    public static AsyncQueueException cancelled(String queueName) {
        return new AsyncQueueException("Queue '" + queueName + "' was cleared", queueName, QueueErrorCode.CANCELLED);
    }

    public static AsyncQueueException timedOut(String queueName, Duration timeout) {
        return new AsyncQueueException("Operation on queue '" + queueName + "' timed out after " + timeout.toMillis() + " ms",
                queueName, QueueErrorCode.TIMED_OUT);
    }

    public String getQueueName() {
        return queueName;
    }

    public QueueErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns true when the operation was aborted by {@code clear()} or {@code close()}
     * rather than by its own deadline or an empty read.
     */
    public boolean isAborted() {
        return errorCode == QueueErrorCode.CLOSED || errorCode == QueueErrorCode.CANCELLED;
    }
}
