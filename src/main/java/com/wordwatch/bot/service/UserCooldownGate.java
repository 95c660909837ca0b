package com.wordwatch.bot.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Optional per-user throttle: when enabled, each (group, user) pair is checked at
 * most once per cooldown window. Independent of the upstream rate limiter.
 */
public class UserCooldownGate {
    private record UserKey(String groupId, String userId) {}

    private final boolean enabled;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<UserKey, Instant> lastChecked = new ConcurrentHashMap<>();

    public UserCooldownGate(boolean enabled, Duration cooldown, Clock clock) {
        this.enabled = enabled;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public static UserCooldownGate disabled() {
        return new UserCooldownGate(false, Duration.ZERO, Clock.systemUTC());
    }

    public boolean tryEnter(String groupId, String userId) {
        if (!enabled) {
            return true;
        }
        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean(false);
        lastChecked.compute(new UserKey(groupId, userId), (key, previous) -> {
            if (previous == null || !now.isBefore(previous.plus(cooldown))) {
                admitted.set(true);
                return now;
            }
            return previous;
        });
        return admitted.get();
    }

    public int evictStale() {
        Instant cutoff = clock.instant().minus(cooldown);
        int before = lastChecked.size();
        lastChecked.values().removeIf(checkedAt -> !checkedAt.isAfter(cutoff));
        return before - lastChecked.size();
    }

    public boolean isEnabled() {
        return enabled;
    }
}
