package com.flow.asyncqueue.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Default implementation of AsyncQueue with an optional capacity limit.
 *
 * All state (buffer, waiting producers, waiting consumers, drain waiter and the
 * closed flag) is guarded by a single lock. Which waiter receives which item is
 * decided while holding the lock; futures are completed and callbacks invoked
 * only after the lock is released, so caller continuations never run inside
 * the critical section.
 *
 * Waiting producers keep their item in their handle. When room appears the
 * item is moved into the buffer in the same critical section that releases
 * the producer, so FIFO order among producers holds and no other add can take
 * the freed slot first.
 *
 * @param <T> the item type
 */
@Slf4j
public class BoundedAsyncQueue<T> implements AsyncQueue<T> {

    public static final String DEFAULT_NAME = "async-queue";

    private final String name;
    private final Integer capacity;
    private final ScheduledExecutorService timer;

    private volatile Consumer<? super T> onAdd;
    private volatile Consumer<? super T> onRemove;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<T> buffer = new ArrayDeque<>();
    private final Deque<PendingAdd> pendingAdds = new ArrayDeque<>();
    private final Deque<PendingTake> pendingTakes = new ArrayDeque<>();
    private CompletableFuture<Void> drainWaiter;
    private volatile boolean closed;

    /**
     * Creates an unbounded queue.
     */
    public BoundedAsyncQueue() {
        this(null, null, null, null, null);
    }

    /**
     * Creates a queue holding at most {@code capacity} items.
     *
     * @param capacity maximum number of buffered items, must be positive
     */
    public BoundedAsyncQueue(int capacity) {
        this(null, capacity, null, null, null);
    }

    /**
     * @param name label used in logs and exception messages, defaults to {@value #DEFAULT_NAME}
     * @param capacity maximum number of buffered items, or null for an unbounded queue
     * @param onAdd invoked after each item enters the queue, may be null
     * @param onRemove invoked after each item leaves the queue, may be null
     * @param timer scheduler that expires timed operations, defaults to {@link QueueTimers#shared()}
     */
    @Builder
    public BoundedAsyncQueue(String name, Integer capacity, Consumer<? super T> onAdd,
                             Consumer<? super T> onRemove, ScheduledExecutorService timer) {
        if (capacity != null && capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, was " + capacity);
        }
        this.name = name != null ? name : DEFAULT_NAME;
        this.capacity = capacity;
        this.onAdd = onAdd;
        this.onRemove = onRemove;
        this.timer = timer != null ? timer : QueueTimers.shared();
    }

    // ==================== Producers ====================

    @Override
    public CompletableFuture<Void> add(T item) {
        return add(item, null);
    }

    @Override
    public CompletableFuture<Void> add(T item, Duration timeout) {
        requireItem(item);
        Deferred deferred = new Deferred();
        CompletableFuture<Void> result;

        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(AsyncQueueException.closed(name));
            }
            if (isFullLocked()) {
                PendingAdd pending = new PendingAdd(item);
                arm(pending, timeout);
                pendingAdds.addLast(pending);
                log.debug("Queue '{}' full, producer waiting (pending adds: {})", name, pendingAdds.size());
                result = pending;
            } else {
                enqueueLocked(item, deferred);
                settleLocked(deferred);
                result = CompletableFuture.completedFuture(null);
            }
        } finally {
            lock.unlock();
        }

        deferred.run();
        return result;
    }

    @Override
    public CompletableFuture<Void> addAll(Iterable<? extends T> items) {
        List<T> batch = new ArrayList<>();
        for (T item : items) {
            requireItem(item);
            batch.add(item);
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (T item : batch) {
            chain = chain.thenCompose(ignored -> add(item));
        }
        return chain;
    }

    // ==================== Consumers ====================

    @Override
    public CompletableFuture<T> take() {
        return take(null);
    }

    @Override
    public CompletableFuture<T> take(Duration timeout) {
        Deferred deferred = new Deferred();
        CompletableFuture<T> result;

        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(AsyncQueueException.closed(name));
            }
            if (buffer.isEmpty()) {
                PendingTake pending = new PendingTake();
                arm(pending, timeout);
                pendingTakes.addLast(pending);
                log.debug("Queue '{}' empty, consumer waiting (pending takes: {})", name, pendingTakes.size());
                result = pending;
            } else {
                T item = buffer.pollFirst();
                deferred.add(() -> notifyRemoved(item));
                settleLocked(deferred);
                result = CompletableFuture.completedFuture(item);
            }
        } finally {
            lock.unlock();
        }

        deferred.run();
        return result;
    }

    @Override
    public T peek() {
        lock.lock();
        try {
            if (closed) {
                throw AsyncQueueException.closed(name);
            }
            if (buffer.isEmpty()) {
                throw AsyncQueueException.empty(name);
            }
            return buffer.peekFirst();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Lifecycle ====================

    @Override
    public void clear() {
        Deferred deferred = new Deferred();
        int dropped;
        int aborted;

        lock.lock();
        try {
            dropped = buffer.size();
            buffer.clear();
            aborted = abortAllLocked(deferred, () -> AsyncQueueException.cancelled(name));
        } finally {
            lock.unlock();
        }

        deferred.run();
        log.info("Queue '{}' cleared: dropped {} items, cancelled {} waiting operations", name, dropped, aborted);
    }

    @Override
    public void close() {
        Deferred deferred = new Deferred();
        int buffered;
        int aborted;

        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            buffered = buffer.size();
            aborted = abortAllLocked(deferred, () -> AsyncQueueException.closed(name));
        } finally {
            lock.unlock();
        }

        deferred.run();
        log.info("Queue '{}' closed with {} buffered items, aborted {} waiting operations", name, buffered, aborted);
    }

    @Override
    public CompletableFuture<Void> waitUntilEmpty() {
        lock.lock();
        try {
            if (buffer.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            if (closed) {
                return CompletableFuture.failedFuture(AsyncQueueException.closed(name));
            }
            if (drainWaiter == null) {
                drainWaiter = new CompletableFuture<>();
            }
            // callers get a copy so one of them cannot cancel the shared waiter for the others
            return drainWaiter.copy();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Callbacks ====================

    public void setOnAdd(Consumer<? super T> onAdd) {
        this.onAdd = onAdd;
    }

    public void setOnRemove(Consumer<? super T> onRemove) {
        this.onRemove = onRemove;
    }

    // ==================== Queries ====================

    @Override
    public String getName() {
        return name;
    }

    @Override
    public OptionalInt getCapacity() {
        return capacity == null ? OptionalInt.empty() : OptionalInt.of(capacity);
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean isFull() {
        lock.lock();
        try {
            return isFullLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of producers waiting for room.
     */
    public int getPendingAddCount() {
        lock.lock();
        try {
            return pendingAdds.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of consumers waiting for an item.
     */
    public int getPendingTakeCount() {
        lock.lock();
        try {
            return pendingTakes.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "BoundedAsyncQueue[" + name + ", capacity=" + (capacity == null ? "unbounded" : capacity)
                + ", size=" + size() + ", closed=" + closed + "]";
    }

    // ==================== Internal state transitions (lock held) ====================

    private boolean isFullLocked() {
        return capacity != null && buffer.size() >= capacity;
    }

    private void enqueueLocked(T item, Deferred deferred) {
        buffer.addLast(item);
        deferred.add(() -> notifyAdded(item));
        log.debug("Enqueued item on queue '{}', size: {}", name, buffer.size());
    }

    /**
     * Hands buffered items to waiting consumers and admits waiting producers
     * until neither is possible, then fulfils the drain waiter if the buffer
     * ended up empty.
     */
    private void settleLocked(Deferred deferred) {
        boolean moved;
        do {
            moved = false;
            while (!buffer.isEmpty() && !pendingTakes.isEmpty()) {
                PendingTake consumer = pendingTakes.pollFirst();
                T item = buffer.pollFirst();
                deferred.add(() -> notifyRemoved(item));
                deferred.add(() -> deliver(consumer, item));
                moved = true;
            }
            while (!pendingAdds.isEmpty() && !isFullLocked()) {
                PendingAdd producer = pendingAdds.pollFirst();
                enqueueLocked(producer.item, deferred);
                deferred.add(() -> release(producer));
                moved = true;
            }
        } while (moved);

        if (buffer.isEmpty() && drainWaiter != null) {
            CompletableFuture<Void> drained = drainWaiter;
            drainWaiter = null;
            deferred.add(() -> drained.complete(null));
            log.debug("Queue '{}' drained", name);
        }
    }

    private int abortAllLocked(Deferred deferred, Supplier<AsyncQueueException> failure) {
        int aborted = pendingAdds.size() + pendingTakes.size();
        for (PendingAdd producer : pendingAdds) {
            deferred.add(() -> abort(producer, failure.get()));
        }
        pendingAdds.clear();
        for (PendingTake consumer : pendingTakes) {
            deferred.add(() -> abort(consumer, failure.get()));
        }
        pendingTakes.clear();
        if (drainWaiter != null) {
            CompletableFuture<Void> drain = drainWaiter;
            drainWaiter = null;
            deferred.add(() -> drain.completeExceptionally(failure.get()));
            aborted++;
        }
        return aborted;
    }

    // ==================== Waiter handling ====================

    private void arm(Waiter<?> waiter, Duration timeout) {
        if (timeout != null) {
            long delayNanos = Math.max(0L, timeout.toNanos());
            waiter.timeoutTask = timer.schedule(() -> expire(waiter, timeout), delayNanos, TimeUnit.NANOSECONDS);
        }
    }

    private void expire(Waiter<?> waiter, Duration timeout) {
        if (unregister(waiter)) {
            log.debug("Operation on queue '{}' timed out after {} ms", name, timeout.toMillis());
            waiter.completeExceptionally(AsyncQueueException.timedOut(name, timeout));
        }
    }

    private boolean unregister(Waiter<?> waiter) {
        lock.lock();
        try {
            return pendingAdds.remove(waiter) || pendingTakes.remove(waiter);
        } finally {
            lock.unlock();
        }
    }

    private void deliver(PendingTake consumer, T item) {
        consumer.disarm();
        consumer.complete(item);
    }

    private void release(PendingAdd producer) {
        producer.disarm();
        producer.complete(null);
    }

    private void abort(Waiter<?> waiter, AsyncQueueException failure) {
        waiter.disarm();
        waiter.completeExceptionally(failure);
    }

    // ==================== Helper Methods ====================

    private void notifyAdded(T item) {
        Consumer<? super T> callback = onAdd;
        if (callback != null) {
            invokeCallback(callback, item, "onAdd");
        }
    }

    private void notifyRemoved(T item) {
        Consumer<? super T> callback = onRemove;
        if (callback != null) {
            invokeCallback(callback, item, "onRemove");
        }
    }

    private void invokeCallback(Consumer<? super T> callback, T item, String hook) {
        try {
            callback.accept(item);
        } catch (RuntimeException e) {
            log.warn("{} callback of queue '{}' failed for item {}", hook, name, item, e);
        }
    }

    private static void requireItem(Object item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
    }

    /**
     * Handle of a waiting add or take, returned to the caller as its future.
     *
     * Cancelling it succeeds only while the handle is still registered. Once
     * the handle has been picked for an item or for room, cancel() returns
     * false and the operation completes normally.
     */
    private class Waiter<R> extends CompletableFuture<R> {

        volatile ScheduledFuture<?> timeoutTask;

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (!unregister(this)) {
                return isCancelled();
            }
            disarm();
            log.debug("Waiting operation on queue '{}' cancelled by caller", name);
            return super.cancel(mayInterruptIfRunning);
        }

        void disarm() {
            ScheduledFuture<?> task = timeoutTask;
            if (task != null) {
                task.cancel(false);
            }
        }
    }

    private final class PendingAdd extends Waiter<Void> {

        final T item;

        PendingAdd(T item) {
            this.item = item;
        }
    }

    private final class PendingTake extends Waiter<T> {
    }

    /**
     * Completions and callbacks collected under the lock, run after it is released.
     */
    private static final class Deferred {

        private final List<Runnable> actions = new ArrayList<>();

        void add(Runnable action) {
            actions.add(action);
        }

        void run() {
            for (Runnable action : actions) {
                action.run();
            }
        }
    }
}
