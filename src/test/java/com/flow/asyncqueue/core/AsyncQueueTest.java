package com.flow.asyncqueue.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class AsyncQueueTest {

    @Test
    @DisplayName("utilization stays correct for very large queues")
    @SuppressWarnings("unchecked")
    void utilizationDoesNotOverflow() {
        AsyncQueue<Integer> queue = mock(AsyncQueue.class, CALLS_REAL_METHODS);
        doReturn(OptionalInt.of(40_000_000)).when(queue).getCapacity();
        doReturn(30_000_000).when(queue).size();

        assertThat(queue.getUtilizationPercent()).isEqualTo(75);
        assertThat(queue.isFull()).isFalse();
    }

    @Test
    @DisplayName("a full queue near Integer.MAX_VALUE reports 100 percent")
    @SuppressWarnings("unchecked")
    void utilizationAtLargeCapacity() {
        AsyncQueue<Integer> queue = mock(AsyncQueue.class, CALLS_REAL_METHODS);
        doReturn(OptionalInt.of(Integer.MAX_VALUE)).when(queue).getCapacity();
        doReturn(Integer.MAX_VALUE).when(queue).size();

        assertThat(queue.getUtilizationPercent()).isEqualTo(100);
        assertThat(queue.isFull()).isTrue();
    }
}
