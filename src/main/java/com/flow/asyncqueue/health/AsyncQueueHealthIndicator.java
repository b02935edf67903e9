package com.flow.asyncqueue.health;

import com.flow.asyncqueue.config.AsyncQueueProperties;
import com.flow.asyncqueue.core.BoundedAsyncQueue;
import com.flow.asyncqueue.registry.AsyncQueueRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for registered queues.
 *
 * Reports depth and utilization of every queue and goes DOWN when a bounded
 * queue reaches the backpressure threshold.
 */
@RequiredArgsConstructor
public class AsyncQueueHealthIndicator implements HealthIndicator {

    private final AsyncQueueRegistry registry;
    private final AsyncQueueProperties properties;

    @Override
    public Health health() {
        int threshold = properties.getHealth().getBackpressureThreshold();
        boolean saturated = false;
        Map<String, Object> details = new LinkedHashMap<>();

        for (BoundedAsyncQueue<?> queue : registry.getQueues()) {
            int utilization = queue.getUtilizationPercent();
            if (queue.getCapacity().isPresent() && utilization >= threshold) {
                saturated = true;
            }
            details.put(queue.getName(), describe(queue, utilization));
        }

        Health.Builder builder = saturated
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("backpressureThreshold", threshold)
                .withDetail("queues", details)
                .build();
    }

    private Map<String, Object> describe(BoundedAsyncQueue<?> queue, int utilization) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("size", queue.size());
        detail.put("capacity", queue.getCapacity().isPresent() ? queue.getCapacity().getAsInt() : "unbounded");
        detail.put("utilizationPercent", utilization);
        detail.put("isFull", queue.isFull());
        detail.put("closed", queue.isClosed());
        detail.put("pendingAdds", queue.getPendingAddCount());
        detail.put("pendingTakes", queue.getPendingTakeCount());
        return detail;
    }
}
