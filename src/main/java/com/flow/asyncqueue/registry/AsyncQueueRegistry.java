package com.flow.asyncqueue.registry;

import com.flow.asyncqueue.config.AsyncQueueMetrics;
import com.flow.asyncqueue.config.AsyncQueueProperties;
import com.flow.asyncqueue.core.BoundedAsyncQueue;
import io.micrometer.core.instrument.Meter;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

/**
 * Creates and tracks named queues.
 *
 * Queues get their capacity from {@link AsyncQueueProperties}, share the
 * configured timeout scheduler and are published as gauges. Creation and
 * removal are serialized so a queue's gauges exist exactly while it is registered. On shutdown every
 * queue is closed and cleared so no caller is left waiting.
 */
@Slf4j
@RequiredArgsConstructor
public class AsyncQueueRegistry {

    private final AsyncQueueProperties properties;
    private final AsyncQueueMetrics metrics;
    private final ScheduledExecutorService timer;

    private final Map<String, Registration> queues = new ConcurrentHashMap<>();

    /**
     * Creates a queue whose capacity comes from configuration.
     *
     * @param name the queue name, unique within this registry
     * @return the new queue
     * @throws IllegalStateException if a queue with this name already exists
     */
    public <T> BoundedAsyncQueue<T> create(String name) {
        return create(name, properties.capacityFor(name));
    }

    /**
     * Creates a queue with an explicit capacity.
     *
     * @param name the queue name, unique within this registry
     * @param capacity maximum number of buffered items, or null for unbounded
     * @return the new queue
     * @throws IllegalStateException if a queue with this name already exists
     */
    public synchronized <T> BoundedAsyncQueue<T> create(String name, Integer capacity) {
        if (queues.containsKey(name)) {
            throw new IllegalStateException("Queue already registered: " + name);
        }
        BoundedAsyncQueue<T> queue = BoundedAsyncQueue.<T>builder()
                .name(name)
                .capacity(capacity)
                .timer(timer)
                .build();

        queues.put(name, new Registration(queue, metrics.registerQueueGauges(queue)));

        log.info("Queue '{}' created with capacity: {}", name, capacity == null ? "unbounded" : capacity);
        return queue;
    }

    /**
     * Looks up a queue by name.
     *
     * @param name the queue name
     * @return the queue if registered, empty otherwise
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<BoundedAsyncQueue<T>> find(String name) {
        return Optional.ofNullable(queues.get(name))
                .map(registration -> (BoundedAsyncQueue<T>) registration.queue);
    }

    /**
     * Closes, clears and deregisters a queue.
     *
     * @param name the queue name
     * @return true if a queue was removed
     */
    public synchronized boolean remove(String name) {
        Registration removed = queues.remove(name);
        if (removed == null) {
            return false;
        }
        release(removed);
        log.info("Queue '{}' removed", name);
        return true;
    }

    /**
     * Returns all registered queues.
     */
    public Collection<BoundedAsyncQueue<?>> getQueues() {
        return queues.values().stream()
                .<BoundedAsyncQueue<?>>map(registration -> registration.queue)
                .collect(Collectors.toList());
    }

    public int count() {
        return queues.size();
    }

    @PreDestroy
    public synchronized void shutdown() {
        int released = queues.size();
        queues.values().forEach(this::release);
        queues.clear();
        log.info("AsyncQueueRegistry shut down, released {} queues", released);
    }

    private void release(Registration registration) {
        registration.queue.close();
        registration.queue.clear();
        metrics.removeQueueGauges(registration.meters);
    }

    private static final class Registration {

        private final BoundedAsyncQueue<?> queue;
        private final List<Meter> meters;

        Registration(BoundedAsyncQueue<?> queue, List<Meter> meters) {
            this.queue = queue;
            this.meters = meters;
        }
    }
}
