package com.wordwatch.bot.client;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cached, rate-limited, retrying front for the classification service.
 *
 * <p>{@link #classify(String)} answers from the cache when it can, otherwise goes
 * through the rate gate and the retry policy. An empty result means the verdict
 * could not be determined; callers must not act on it and must not treat it as
 * clean. Only violating verdicts are cached.
 */
public class ClassificationClient {
    private static final Logger log = LoggerFactory.getLogger(ClassificationClient.class);

    public record ClientStats(long attempted, long succeeded, long failed, long cacheHits, long rateLimited) {}

    private final UpstreamClassifier upstream;
    private final ContentCache cache;
    private final SlidingWindowLimiter limiter;
    private final RetryPolicy retryPolicy;
    private final Duration maxRateWait;
    private final Sleeper sleeper;

    private final AtomicLong attempted = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();

    public ClassificationClient(
            UpstreamClassifier upstream,
            ContentCache cache,
            SlidingWindowLimiter limiter,
            RetryPolicy retryPolicy,
            Duration maxRateWait,
            Sleeper sleeper
    ) {
        this.upstream = upstream;
        this.cache = cache;
        this.limiter = limiter;
        this.retryPolicy = retryPolicy;
        this.maxRateWait = maxRateWait;
        this.sleeper = sleeper;
    }

    /**
     * @throws InterruptedException if cancelled while waiting on the rate gate or a backoff
     */
    public Optional<Verdict> classify(String text) throws InterruptedException {
        if (text == null || text.isBlank()) {
            return Optional.of(Verdict.clean());
        }
        Optional<Verdict> cached = cache.get(text);
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            return cached;
        }
        if (!acquirePermit()) {
            rateLimited.incrementAndGet();
            log.info("Classification skipped: upstream rate limit reached");
            return Optional.empty();
        }

        attempted.incrementAndGet();
        RetryPolicy.Outcome<Verdict> outcome = retryPolicy.run(() -> upstream.classify(text));
        if (!outcome.succeeded()) {
            limiter.recordOutcome(false);
            failed.incrementAndGet();
            log.warn("Classification failed after {} attempt(s): {}",
                    outcome.attemptsUsed(), describe(outcome.lastError()));
            return Optional.empty();
        }
        limiter.recordOutcome(true);
        succeeded.incrementAndGet();
        Verdict verdict = outcome.result();
        if (verdict.violation()) {
            cache.put(text, verdict);
        }
        return Optional.of(verdict);
    }

    private boolean acquirePermit() throws InterruptedException {
        SlidingWindowLimiter.Permit permit = limiter.tryAcquire();
        if (permit.permitted()) {
            return true;
        }
        Duration wait = permit.retryAfter();
        if (wait.compareTo(maxRateWait) > 0) {
            return false;
        }
        log.debug("Rate gate closed; waiting {} ms", wait.toMillis());
        sleeper.sleep(wait);
        return limiter.tryAcquire().permitted();
    }

    public ClientStats stats() {
        return new ClientStats(
                attempted.get(),
                succeeded.get(),
                failed.get(),
                cacheHits.get(),
                rateLimited.get()
        );
    }

    public ContentCache cache() {
        return cache;
    }

    public SlidingWindowLimiter limiter() {
        return limiter;
    }

    private static String describe(Exception error) {
        if (error instanceof UpstreamException upstreamError && upstreamError.isThrottled()) {
            return "throttled by upstream (HTTP 429)";
        }
        return error == null ? "unknown error" : error.getMessage();
    }
}
