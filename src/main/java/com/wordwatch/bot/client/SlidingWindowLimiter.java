package com.wordwatch.bot.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-minute and per-hour call budget for the classification service, plus a
 * cooldown that follows a failed call. A granted permit takes its slot in both
 * windows straight away, so calls still in flight count against the budget.
 * Never blocks: callers decide whether to wait out {@link Permit#retryAfterSeconds()}.
 */
public class SlidingWindowLimiter {
    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);

    public record Permit(boolean permitted, double retryAfterSeconds) {
        static Permit granted() {
            return new Permit(true, 0);
        }

        static Permit denied(Duration wait) {
            // Round up so a denial never reports a zero wait.
            long millis = Math.max(1, (wait.toNanos() + 999_999) / 1_000_000);
            return new Permit(false, millis / 1000.0);
        }

        public Duration retryAfter() {
            return Duration.ofMillis((long) Math.ceil(retryAfterSeconds * 1000));
        }
    }

    public record WindowState(int callsLastMinute, int callsLastHour, boolean coolingDown) {}

    private final int maxPerMinute;
    private final int maxPerHour;
    private final Duration failureCooldown;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> minuteWindow = new ArrayDeque<>();
    private final Deque<Instant> hourWindow = new ArrayDeque<>();
    private Instant cooldownUntil;

    public SlidingWindowLimiter(int maxPerMinute, int maxPerHour, Duration failureCooldown, Clock clock) {
        if (maxPerMinute < 1 || maxPerHour < 1) {
            throw new IllegalArgumentException("Window capacities must be positive");
        }
        this.maxPerMinute = maxPerMinute;
        this.maxPerHour = maxPerHour;
        this.failureCooldown = failureCooldown;
        this.clock = clock;
    }

    public Permit tryAcquire() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (cooldownUntil != null) {
                if (now.isBefore(cooldownUntil)) {
                    return Permit.denied(Duration.between(now, cooldownUntil));
                }
                cooldownUntil = null;
            }
            prune(minuteWindow, now.minus(MINUTE));
            prune(hourWindow, now.minus(HOUR));

            // The window with the later expiry is the one that binds.
            Duration wait = Duration.ZERO;
            if (minuteWindow.size() >= maxPerMinute) {
                wait = longest(wait, Duration.between(now, minuteWindow.peekFirst().plus(MINUTE)));
            }
            if (hourWindow.size() >= maxPerHour) {
                wait = longest(wait, Duration.between(now, hourWindow.peekFirst().plus(HOUR)));
            }
            if (!wait.isZero()) {
                return Permit.denied(wait);
            }
            minuteWindow.addLast(now);
            hourWindow.addLast(now);
            return Permit.granted();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes out a granted call. A failure hands its slot back and starts the
     * cooldown; a success keeps the slot and ends any cooldown.
     */
    public void recordOutcome(boolean success) {
        lock.lock();
        try {
            if (success) {
                cooldownUntil = null;
            } else {
                minuteWindow.pollLast();
                hourWindow.pollLast();
                cooldownUntil = clock.instant().plus(failureCooldown);
            }
        } finally {
            lock.unlock();
        }
    }

    public WindowState state() {
        lock.lock();
        try {
            Instant now = clock.instant();
            prune(minuteWindow, now.minus(MINUTE));
            prune(hourWindow, now.minus(HOUR));
            boolean coolingDown = cooldownUntil != null && now.isBefore(cooldownUntil);
            return new WindowState(minuteWindow.size(), hourWindow.size(), coolingDown);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            minuteWindow.clear();
            hourWindow.clear();
            cooldownUntil = null;
        } finally {
            lock.unlock();
        }
    }

    private static void prune(Deque<Instant> window, Instant cutoff) {
        while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
            window.pollFirst();
        }
    }

    private static Duration longest(Duration left, Duration right) {
        return left.compareTo(right) >= 0 ? left : right;
    }
}
