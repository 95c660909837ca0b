package com.wordwatch.bot.client;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded exponential backoff. Failures are folded into {@link Outcome#succeeded()};
 * only interruption escapes, and it escapes immediately.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);
    private static final long JITTER_SPREAD_MILLIS = 97;

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws Exception;
    }

    public record Outcome<T>(T result, boolean succeeded, int attemptsUsed, Exception lastError) {}

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
    }

    public <T> Outcome<T> run(Attempt<T> operation) throws InterruptedException {
        Exception lastError = null;
        int attempts = maxRetries + 1;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return new Outcome<>(operation.call(), true, attempt + 1, null);
            } catch (InterruptedException error) {
                throw error;
            } catch (Exception error) {
                lastError = error;
                if (attempt + 1 < attempts) {
                    Duration delay = delayFor(attempt);
                    log.debug("Attempt {} of {} failed ({}); retrying in {} ms",
                            attempt + 1, attempts, error.getMessage(), delay.toMillis());
                    sleeper.sleep(delay);
                }
            }
        }
        return new Outcome<>(null, false, attempts, lastError);
    }

    Duration delayFor(int attempt) {
        long baseMillis = baseDelay.toMillis();
        long exponential = baseMillis << Math.min(attempt, 30);
        if (exponential < baseMillis) {
            exponential = Long.MAX_VALUE;
        }
        long capped = Math.min(maxDelay.toMillis(), exponential);
        // Deterministic spread so concurrent callers do not retry in lockstep.
        long jitter = (attempt * 37L + 11L) % JITTER_SPREAD_MILLIS;
        return Duration.ofMillis(capped + jitter);
    }

    public int maxRetries() {
        return maxRetries;
    }
}
