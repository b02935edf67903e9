package com.flow.asyncqueue.core;

/**
 * Failure conditions reported by {@link AsyncQueue} operations.
 */
public enum QueueErrorCode {

    /**
     * The queue was closed before or while the operation was waiting.
     */
    CLOSED,

    /**
     * {@code peek()} on an open queue that holds no items.
     */
    EMPTY_QUEUE,

    /**
     * A waiting operation was aborted by {@code clear()}.
     */
    CANCELLED,

    /**
     * The caller-supplied deadline elapsed before the operation could complete.
     */
    TIMED_OUT
}
