package com.vidforge.worker.service.render;

import com.vidforge.worker.config.WorkerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RenderDispatchThrottleTest {

    private RenderDispatchThrottle throttle;

    @BeforeEach
    void setUp() {
        WorkerProperties properties = new WorkerProperties();
        properties.getRender().getThrottle().setInitialDelayMs(2000);
        properties.getRender().getThrottle().setMinDelayMs(1000);
        properties.getRender().getThrottle().setMaxDelayMs(4000);
        throttle = new RenderDispatchThrottle(properties);
    }

    @Test
    void testRateLimited_IncreasesUpToMax() {
        // When
        throttle.recordRateLimited();
        long afterFirst = throttle.getCurrentDelayMs();
        throttle.recordRateLimited();
        throttle.recordRateLimited();

        // Then
        assertEquals(3000, afterFirst);
        assertEquals(4000, throttle.getCurrentDelayMs());
    }

    @Test
    void testSuccessStreak_DecreasesAfterThreeSuccesses() {
        // When
        throttle.recordSuccess();
        throttle.recordSuccess();
        long beforeStreak = throttle.getCurrentDelayMs();
        throttle.recordSuccess();

        // Then
        assertEquals(2000, beforeStreak);
        assertEquals(1800, throttle.getCurrentDelayMs());
    }

    @Test
    void testFirstDispatch_DoesNotWait() throws Exception {
        // Given
        long start = System.nanoTime();

        // When
        throttle.waitIfNeeded();

        // Then
        assertTrue((System.nanoTime() - start) / 1_000_000 < 1000, "First dispatch should not be delayed");
    }
}
