package com.flow.asyncqueue.core;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Schedulers used to expire timed {@code add}/{@code take} operations.
 */
public final class QueueTimers {

    public static final String DEFAULT_THREAD_NAME_PREFIX = "async-queue-timer-";

    private QueueTimers() {
    }

    /**
     * Returns the process-wide scheduler used by queues that were not given one.
     * Its single thread is a daemon and lives for the lifetime of the JVM.
     * Timed-out operations are failed on this thread, so it is shared by the
     * non-async continuations of every queue using it.
     */
    public static ScheduledExecutorService shared() {
        return SharedHolder.INSTANCE;
    }

    /**
     * Creates a single-threaded daemon scheduler. Cancelled timeouts are removed
     * from its work queue right away, so fulfilled operations do not pile up.
     *
     * @param threadNamePrefix prefix for the timer thread name
     * @return a new scheduler, owned by the caller
     */
    public static ScheduledExecutorService newTimer(String threadNamePrefix) {
        AtomicInteger sequence = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private static final class SharedHolder {
        private static final ScheduledExecutorService INSTANCE = newTimer(DEFAULT_THREAD_NAME_PREFIX);
    }
}
