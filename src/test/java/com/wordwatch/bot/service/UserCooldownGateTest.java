package com.wordwatch.bot.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.wordwatch.bot.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class UserCooldownGateTest {
    private final MutableClock clock = MutableClock.at("2026-03-10T12:00:00");

    @Test
    void disabledGateAdmitsEverything() {
        UserCooldownGate gate = UserCooldownGate.disabled();

        assertFalse(gate.isEnabled());
        assertTrue(gate.tryEnter("g1", "u1"));
        assertTrue(gate.tryEnter("g1", "u1"));
    }

    @Test
    void admitsOncePerWindowPerPair() {
        UserCooldownGate gate = new UserCooldownGate(true, Duration.ofSeconds(10), clock);

        assertTrue(gate.tryEnter("g1", "u1"));
        assertFalse(gate.tryEnter("g1", "u1"));
        assertTrue(gate.tryEnter("g1", "u2"));
        assertTrue(gate.tryEnter("g2", "u1"));

        clock.advance(Duration.ofMillis(9999));
        assertFalse(gate.tryEnter("g1", "u1"));
        clock.advance(Duration.ofMillis(1));
        assertTrue(gate.tryEnter("g1", "u1"));
    }

    @Test
    void rejectedAttemptDoesNotExtendTheWindow() {
        UserCooldownGate gate = new UserCooldownGate(true, Duration.ofSeconds(10), clock);

        gate.tryEnter("g1", "u1");
        clock.advance(Duration.ofSeconds(5));
        assertFalse(gate.tryEnter("g1", "u1"));
        clock.advance(Duration.ofSeconds(5));
        assertTrue(gate.tryEnter("g1", "u1"));
    }

    @Test
    void evictsMarksOlderThanTheWindow() {
        UserCooldownGate gate = new UserCooldownGate(true, Duration.ofSeconds(10), clock);
        gate.tryEnter("g1", "u1");
        clock.advance(Duration.ofSeconds(6));
        gate.tryEnter("g1", "u2");

        clock.advance(Duration.ofSeconds(5));
        assertEquals(1, gate.evictStale());
        assertEquals(0, gate.evictStale());
    }
}
