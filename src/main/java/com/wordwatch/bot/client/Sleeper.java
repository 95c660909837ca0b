package com.wordwatch.bot.client;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Interruptible pause used for backoff and rate-limit waits.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                TimeUnit.MILLISECONDS.sleep(duration.toMillis());
            }
        };
    }
}
