package com.propertyintel.leads.scheduler;

import com.propertyintel.leads.service.PropertyCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CacheRefreshSchedulerTest {

    private final PropertyCache cache = mock(PropertyCache.class);
    private CacheRefreshScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    void refreshesImmediatelyOnStart() {
        scheduler = new CacheRefreshScheduler(cache, true, Duration.ofHours(1), Duration.ofSeconds(5));

        assertNotNull(scheduler.start());

        verify(cache, timeout(2000)).refresh();
        assertTrue(scheduler.isRunning());
    }

    @Test
    void startTwiceReturnsRunningTask() {
        scheduler = new CacheRefreshScheduler(cache, true, Duration.ofHours(1), Duration.ofSeconds(5));

        Future<?> first = scheduler.start();
        assertSame(first, scheduler.start());
    }

    @Test
    void failedRefreshDoesNotStopLoop() {
        doThrow(new IllegalStateException("upstream down")).when(cache).refresh();
        scheduler = new CacheRefreshScheduler(cache, true, Duration.ofMillis(20), Duration.ofSeconds(5));

        scheduler.start();

        verify(cache, timeout(2000).atLeast(3)).refresh();
        assertTrue(scheduler.isRunning());
    }

    @Test
    void stopInterruptsSleepAndWaitsForExit() {
        scheduler = new CacheRefreshScheduler(cache, true, Duration.ofHours(1), Duration.ofSeconds(5));
        Future<?> task = scheduler.start();
        verify(cache, timeout(2000)).refresh();

        long started = System.nanoTime();
        scheduler.stop();
        Duration took = Duration.ofNanos(System.nanoTime() - started);

        assertTrue(took.compareTo(Duration.ofSeconds(2)) < 0, "stop took " + took);
        assertTrue(task.isDone());
        assertFalse(scheduler.isRunning());
        verify(cache, times(1)).refresh();
    }

    @Test
    void canRestartAfterStop() {
        scheduler = new CacheRefreshScheduler(cache, true, Duration.ofHours(1), Duration.ofSeconds(5));
        scheduler.start();
        scheduler.stop();

        assertNotNull(scheduler.start());
        verify(cache, timeout(2000).times(2)).refresh();
    }

    @Test
    void disabledSchedulerNeverStarts() {
        scheduler = new CacheRefreshScheduler(cache, false, Duration.ofMillis(20), Duration.ofSeconds(5));

        assertNull(scheduler.start());
        assertFalse(scheduler.isRunning());
        verifyNoInteractions(cache);
    }

    @Test
    void stopWithoutStartIsNoOp() {
        scheduler = new CacheRefreshScheduler(cache, true, Duration.ofHours(1), Duration.ofSeconds(5));
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}
