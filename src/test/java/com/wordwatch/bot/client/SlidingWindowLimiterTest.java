package com.wordwatch.bot.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.wordwatch.bot.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SlidingWindowLimiterTest {
    private final MutableClock clock = MutableClock.at("2026-03-10T12:00:00");

    @Test
    void fullMinuteWindowDeniesUntilItSlides() {
        SlidingWindowLimiter limiter = new SlidingWindowLimiter(3, 100, Duration.ofSeconds(30), clock);
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.tryAcquire().permitted());
            limiter.recordOutcome(true);
            clock.advance(Duration.ofSeconds(1));
        }

        SlidingWindowLimiter.Permit denied = limiter.tryAcquire();
        assertFalse(denied.permitted());
        assertEquals(57.0, denied.retryAfterSeconds(), 0.001);

        clock.advance(Duration.ofSeconds(57));
        assertTrue(limiter.tryAcquire().permitted());
    }

    @Test
    void hourWindowBindsWhenItExpiresLater() {
        SlidingWindowLimiter limiter = new SlidingWindowLimiter(2, 2, Duration.ofSeconds(30), clock);
        assertTrue(limiter.tryAcquire().permitted());
        assertTrue(limiter.tryAcquire().permitted());

        SlidingWindowLimiter.Permit denied = limiter.tryAcquire();
        assertFalse(denied.permitted());
        assertEquals(3600.0, denied.retryAfterSeconds(), 0.001);

        clock.advance(Duration.ofMinutes(2));
        assertFalse(limiter.tryAcquire().permitted());
        clock.advance(Duration.ofMinutes(58));
        assertTrue(limiter.tryAcquire().permitted());
    }

    @Test
    void failureStartsCooldownThatSuccessClears() {
        SlidingWindowLimiter limiter = new SlidingWindowLimiter(10, 100, Duration.ofSeconds(30), clock);
        limiter.recordOutcome(false);

        SlidingWindowLimiter.Permit denied = limiter.tryAcquire();
        assertFalse(denied.permitted());
        assertEquals(30.0, denied.retryAfterSeconds(), 0.001);
        assertTrue(limiter.state().coolingDown());

        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire().permitted());

        limiter.recordOutcome(false);
        limiter.recordOutcome(true);
        assertTrue(limiter.tryAcquire().permitted());
        assertEquals(1, limiter.state().callsLastMinute());
    }

    @Test
    void resetForgetsHistory() {
        SlidingWindowLimiter limiter = new SlidingWindowLimiter(1, 1, Duration.ofSeconds(30), clock);
        assertTrue(limiter.tryAcquire().permitted());
        assertFalse(limiter.tryAcquire().permitted());

        limiter.reset();

        assertTrue(limiter.tryAcquire().permitted());
    }

    @Test
    void grantedPermitHoldsItsSlotBeforeTheCallFinishes() {
        SlidingWindowLimiter limiter = new SlidingWindowLimiter(2, 100, Duration.ofSeconds(30), clock);

        assertTrue(limiter.tryAcquire().permitted());
        assertTrue(limiter.tryAcquire().permitted());

        assertFalse(limiter.tryAcquire().permitted());
        assertEquals(2, limiter.state().callsLastMinute());
    }

    @Test
    void failedCallHandsItsSlotBack() {
        SlidingWindowLimiter limiter = new SlidingWindowLimiter(1, 100, Duration.ofSeconds(30), clock);
        assertTrue(limiter.tryAcquire().permitted());

        limiter.recordOutcome(false);

        assertEquals(0, limiter.state().callsLastMinute());
        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire().permitted());
    }

    @Test
    void subMillisecondWaitIsReportedAsOneMillisecond() {
        SlidingWindowLimiter limiter = new SlidingWindowLimiter(1, 100, Duration.ofSeconds(30), clock);
        assertTrue(limiter.tryAcquire().permitted());

        clock.advance(Duration.ofMinutes(1).minusNanos(500));
        SlidingWindowLimiter.Permit denied = limiter.tryAcquire();

        assertFalse(denied.permitted());
        assertEquals(0.001, denied.retryAfterSeconds(), 1e-9);
        assertEquals(Duration.ofMillis(1), denied.retryAfter());
    }
}
