package com.flow.asyncqueue.config;

import com.flow.asyncqueue.core.BoundedAsyncQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer gauges for queues managed by the registry.
 *
 * Every gauge is tagged with the queue name so several queues can share a meter name.
 */
@Getter
public class AsyncQueueMetrics {

    public static final String SIZE = "async.queue.size";
    public static final String PENDING_ADDS = "async.queue.pending.adds";
    public static final String PENDING_TAKES = "async.queue.pending.takes";
    public static final String UTILIZATION = "async.queue.utilization";
    public static final String QUEUE_TAG = "queue";

    private final MeterRegistry registry;

    public AsyncQueueMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the gauges of one queue.
     *
     * @param queue the queue to observe
     * @return the registered meters, to be passed to {@link #removeQueueGauges(List)}
     */
    public List<Meter> registerQueueGauges(BoundedAsyncQueue<?> queue) {
        return List.of(
                registerQueueGauge(queue, SIZE, "Current number of buffered items", BoundedAsyncQueue::size),
                registerQueueGauge(queue, PENDING_ADDS, "Producers waiting for room",
                        BoundedAsyncQueue::getPendingAddCount),
                registerQueueGauge(queue, PENDING_TAKES, "Consumers waiting for an item",
                        BoundedAsyncQueue::getPendingTakeCount),
                registerQueueGauge(queue, UTILIZATION, "Queue utilization percentage",
                        BoundedAsyncQueue::getUtilizationPercent)
        );
    }

    /**
     * Removes gauges previously returned by {@link #registerQueueGauges(BoundedAsyncQueue)}.
     */
    public void removeQueueGauges(List<Meter> meters) {
        meters.forEach(registry::remove);
    }

    private Meter registerQueueGauge(BoundedAsyncQueue<?> queue, String name, String description,
                                     ToDoubleFunction<BoundedAsyncQueue<?>> value) {
        return Gauge.<BoundedAsyncQueue<?>>builder(name, queue, value)
                .description(description)
                .tag(QUEUE_TAG, queue.getName())
                .strongReference(true)
                .register(registry);
    }
}
