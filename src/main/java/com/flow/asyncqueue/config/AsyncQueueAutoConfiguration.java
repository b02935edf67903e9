package com.flow.asyncqueue.config;

import com.flow.asyncqueue.core.QueueTimers;
import com.flow.asyncqueue.health.AsyncQueueHealthIndicator;
import com.flow.asyncqueue.registry.AsyncQueueRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Auto-configuration for async queues.
 *
 * Provides the timeout scheduler, the queue registry, queue gauges and the
 * queue health indicator. Every bean backs off when the application defines
 * its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(AsyncQueueProperties.class)
public class AsyncQueueAutoConfiguration {

    // ==================== Scheduler ====================

    /**
     * Scheduler that expires timed add/take operations of registry queues.
     */
    @Bean(name = "asyncQueueTimer", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "asyncQueueTimer")
    public ScheduledExecutorService asyncQueueTimer(AsyncQueueProperties properties) {
        String prefix = properties.getTimer().getThreadNamePrefix();
        log.info("Initializing async queue timer with thread prefix: {}", prefix);
        return QueueTimers.newTimer(prefix);
    }

    // ==================== Registry ====================

    @Bean
    @ConditionalOnMissingBean
    public AsyncQueueMetrics asyncQueueMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new AsyncQueueMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public AsyncQueueRegistry asyncQueueRegistry(AsyncQueueProperties properties,
                                                 AsyncQueueMetrics metrics,
                                                 @Qualifier("asyncQueueTimer") ScheduledExecutorService timer) {
        return new AsyncQueueRegistry(properties, metrics, timer);
    }

    // ==================== Health ====================

    @Bean
    @ConditionalOnMissingBean
    public AsyncQueueHealthIndicator asyncQueueHealthIndicator(AsyncQueueRegistry registry,
                                                               AsyncQueueProperties properties) {
        return new AsyncQueueHealthIndicator(registry, properties);
    }
}
