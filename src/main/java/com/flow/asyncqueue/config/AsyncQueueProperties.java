package com.flow.asyncqueue.config;

import com.flow.asyncqueue.core.QueueTimers;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for queues created through the registry.
 *
 * Controls default and per-queue capacities, the timeout scheduler and
 * the health threshold.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "async.queue")
public class AsyncQueueProperties {

    /**
     * Capacity applied to queues without an explicit entry. Unset means unbounded.
     */
    @Positive
    private Integer defaultCapacity;

    /**
     * Per-queue settings, keyed by queue name.
     */
    @Valid
    private Map<String, QueueSettings> queues = new LinkedHashMap<>();

    /**
     * Timeout scheduler configuration.
     */
    @Valid
    private TimerConfig timer = new TimerConfig();

    /**
     * Health reporting configuration.
     */
    @Valid
    private HealthConfig health = new HealthConfig();

    /**
     * Resolves the capacity for a queue: its own entry first, then the default.
     *
     * @param name the queue name
     * @return the capacity, or null for an unbounded queue
     */
    public Integer capacityFor(String name) {
        QueueSettings settings = queues.get(name);
        if (settings != null && settings.getCapacity() != null) {
            return settings.getCapacity();
        }
        return defaultCapacity;
    }

    @Getter
    @Setter
    public static class QueueSettings {

        /**
         * Maximum number of buffered items. Unset falls back to the default capacity.
         */
        @Positive
        private Integer capacity;
    }

    @Getter
    @Setter
    public static class TimerConfig {

        /**
         * Name prefix of the thread that expires timed operations.
         */
        @NotBlank
        private String threadNamePrefix = QueueTimers.DEFAULT_THREAD_NAME_PREFIX;
    }

    @Getter
    @Setter
    public static class HealthConfig {

        /**
         * Utilization (percentage) at which a bounded queue reports DOWN.
         */
        @Min(1)
        @Max(100)
        private int backpressureThreshold = 80;
    }
}
