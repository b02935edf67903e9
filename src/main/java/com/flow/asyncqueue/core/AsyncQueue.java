package com.flow.asyncqueue.core;

import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous FIFO queue shared between producers and consumers.
 *
 * Waiting operations return futures instead of blocking the caller. A future
 * that fails is completed with an {@link AsyncQueueException}.
 *
 * @param <T> the item type
 */
public interface AsyncQueue<T> {

    /**
     * Adds an item at the tail, waiting for room if the queue is full.
     * Cancelling the returned future withdraws the add unless the item has
     * already been enqueued, in which case {@code cancel} returns false.
     *
     * @param item the item to add, never null
     * @return a future completed once the item is enqueued
     */
    CompletableFuture<Void> add(T item);

    /**
     * Adds an item at the tail, waiting at most {@code timeout} for room.
     *
     * A timed-out future is failed on the queue's timer thread, so continuations
     * attached with non-async methods run there. Such continuations must not block:
     * they would delay every other timeout sharing that timer. Use the
     * {@code *Async} variants for blocking work.
     *
     * @param item the item to add, never null
     * @param timeout maximum time to wait for room, or null to wait indefinitely
     * @return a future completed once the item is enqueued, or failed with
     *         {@link QueueErrorCode#TIMED_OUT} if no room appeared in time
     */
    CompletableFuture<Void> add(T item, Duration timeout);

    /**
     * Adds the items one after another, in iteration order.
     * Not atomic: items added before a failure stay in the queue.
     *
     * @param items the items to add
     * @return a future completed once the last item is enqueued
     */
    CompletableFuture<Void> addAll(Iterable<? extends T> items);

    /**
     * Removes and returns the head item, waiting for one if the queue is empty.
     * Cancelling the returned future withdraws the take unless an item has
     * already been picked for it, in which case {@code cancel} returns false.
     *
     * @return a future completed with the head item
     */
    CompletableFuture<T> take();

    /**
     * Removes and returns the head item, waiting at most {@code timeout} for one.
     * As with {@link #add(Object, Duration)}, a timeout fails the future on the
     * timer thread; do not block in non-async continuations.
     *
     * @param timeout maximum time to wait, or null to wait indefinitely
     * @return a future completed with the head item
     */
    CompletableFuture<T> take(Duration timeout);

    /**
     * Returns the head item without removing it.
     *
     * @return the head item
     * @throws AsyncQueueException with {@link QueueErrorCode#CLOSED} or {@link QueueErrorCode#EMPTY_QUEUE}
     */
    T peek();

    /**
     * Removes all items and fails every waiting add, take and wait with
     * {@link QueueErrorCode#CANCELLED}.
     */
    void clear();

    /**
     * Closes the queue and fails every waiting operation. Idempotent.
     */
    void close();

    /**
     * Waits until the queue has been drained.
     *
     * @return a future completed when the queue becomes empty
     */
    CompletableFuture<Void> waitUntilEmpty();

    String getName();

    /**
     * Gets the configured capacity.
     *
     * @return the capacity, or empty if the queue is unbounded
     */
    OptionalInt getCapacity();

    /**
     * Gets the current number of buffered items.
     *
     * @return number of items in the queue
     */
    int size();

    boolean isClosed();

    boolean isEmpty();

    /**
     * Checks if the queue is at capacity. An unbounded queue is never full.
     *
     * @return true if full
     */
    default boolean isFull() {
        OptionalInt capacity = getCapacity();
        return capacity.isPresent() && size() >= capacity.getAsInt();
    }

    /**
     * Gets the queue utilization as a percentage.
     *
     * @return utilization percentage (0-100), always 0 for an unbounded queue
     */
    default int getUtilizationPercent() {
        OptionalInt capacity = getCapacity();
        return capacity.isPresent() ? (int) ((size() * 100L) / capacity.getAsInt()) : 0;
    }
}
