package com.wordwatch.bot.service;

import com.wordwatch.bot.client.ClassificationClient;
import com.wordwatch.bot.client.ContentCache;
import com.wordwatch.bot.client.HttpUpstreamClassifier;
import com.wordwatch.bot.client.RetryPolicy;
import com.wordwatch.bot.client.Sleeper;
import com.wordwatch.bot.client.SlidingWindowLimiter;
import com.wordwatch.bot.client.Verdict;
import com.wordwatch.bot.config.MonitorConfig;
import com.wordwatch.bot.ledger.BanLadder;
import com.wordwatch.bot.ledger.ConnectionPool;
import com.wordwatch.bot.ledger.LedgerException;
import com.wordwatch.bot.ledger.ViolationLedger;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for the platform: local keyword check, then remote
 * classification, then the ledger. Returns data only; deleting and suspending
 * are left to the caller (see {@link DecisionExecutor}).
 */
public class ModerationOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ModerationOrchestrator.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    public record ProbeResult(ModerationOutcome.Status status, ModerationOutcome.Source source, List<String> matchedWords) {}

    public record StatusSnapshot(
            ClassificationClient.ClientStats client,
            SlidingWindowLimiter.WindowState limiter,
            int cacheSize,
            ConnectionPool.PoolStats pool,
            int keywordCount,
            boolean localCheckEnabled,
            boolean userCooldownEnabled,
            ModerationStatistics.Snapshot statistics
    ) {}

    private final AtomicReference<ClassificationClient> client;
    private final ViolationLedger ledger;
    private final KeywordMatcher keywordMatcher;
    private final boolean localCheckEnabled;
    private final Set<String> groupWhitelist;
    private final UserCooldownGate cooldownGate;
    private final ModerationStatistics statistics;
    private final ExecutorService workers;
    private final ScheduledExecutorService maintenance;

    public ModerationOrchestrator(
            ClassificationClient client,
            ViolationLedger ledger,
            KeywordMatcher keywordMatcher,
            boolean localCheckEnabled,
            List<String> groupWhitelist,
            UserCooldownGate cooldownGate,
            ModerationStatistics statistics,
            int workerThreads
    ) {
        this.client = new AtomicReference<>(client);
        this.ledger = ledger;
        this.keywordMatcher = keywordMatcher;
        this.localCheckEnabled = localCheckEnabled;
        this.groupWhitelist = Set.copyOf(groupWhitelist);
        this.cooldownGate = cooldownGate;
        this.statistics = statistics;
        this.workers = Executors.newFixedThreadPool(workerThreads);
        this.maintenance = Executors.newSingleThreadScheduledExecutor();
    }

    public static ModerationOrchestrator fromConfig(MonitorConfig config, Clock clock) throws LedgerException {
        MonitorConfig.BanRules rules = config.banRules();
        BanLadder ladder = config.autoBanEnabled()
                ? new BanLadder(rules.firstBanSeconds(), rules.secondBanSeconds(), rules.thirdBanSeconds())
                : BanLadder.disabled();
        ConnectionPool pool = ConnectionPool.sqlite(Paths.get(config.databasePath()), config.pool());
        ViolationLedger ledger;
        try {
            ledger = new ViolationLedger(pool, ladder, rules.resetHour(), rules.retentionDays(), clock);
        } catch (LedgerException error) {
            pool.close();
            throw error;
        }
        return new ModerationOrchestrator(
                buildClient(config, clock),
                ledger,
                new KeywordMatcher(config.forbiddenWords()),
                config.localCheckEnabled(),
                config.groupWhitelist(),
                new UserCooldownGate(config.userCooldownEnabled(), config.userCooldown(), clock),
                new ModerationStatistics(config.statisticsEnabled()),
                config.workerThreads()
        );
    }

    public static ClassificationClient buildClient(MonitorConfig config, Clock clock) {
        MonitorConfig.RateLimitSettings rate = config.rateLimit();
        MonitorConfig.RetrySettings retry = config.retry();
        Sleeper sleeper = Sleeper.system();
        return new ClassificationClient(
                new HttpUpstreamClassifier(config.upstream()),
                new ContentCache(config.cache().ttl(), config.cache().maxEntries(), clock),
                new SlidingWindowLimiter(rate.maxPerMinute(), rate.maxPerHour(), rate.failureCooldown(), clock),
                new RetryPolicy(retry.maxRetries(), retry.baseDelay(), retry.maxDelay(), sleeper),
                rate.maxWait(),
                sleeper
        );
    }

    /**
     * Moderates one message on the calling thread.
     *
     * @throws InterruptedException if cancelled during a rate-limit wait, a backoff or a ledger wait
     */
    public ModerationOutcome moderate(InboundMessage message) throws InterruptedException {
        if (!groupWhitelist.isEmpty() && !groupWhitelist.contains(message.groupId())) {
            return ModerationOutcome.skipped("group not monitored");
        }
        if (!cooldownGate.tryEnter(message.groupId(), message.userId())) {
            return ModerationOutcome.skipped("user cooldown");
        }
        statistics.recordCheck();

        List<String> localWords = localCheckEnabled ? keywordMatcher.match(message.text()) : List.of();
        if (!localWords.isEmpty()) {
            return escalate(message, localWords, ModerationOutcome.Source.LOCAL);
        }

        Optional<Verdict> verdict = client.get().classify(message.text());
        if (verdict.isEmpty()) {
            log.info("Verdict unknown for {}/{}; message left unactioned", message.groupId(), message.userId());
            return ModerationOutcome.unknown("classification unavailable");
        }
        if (!verdict.get().violation()) {
            return ModerationOutcome.clean();
        }
        return escalate(message, verdict.get().matchedTerms(), ModerationOutcome.Source.REMOTE);
    }

    public CompletableFuture<ModerationOutcome> submit(InboundMessage message) {
        CompletableFuture<ModerationOutcome> future = new CompletableFuture<>();
        try {
            workers.execute(() -> {
                try {
                    future.complete(moderate(message));
                } catch (InterruptedException error) {
                    Thread.currentThread().interrupt();
                    future.completeExceptionally(error);
                } catch (RuntimeException error) {
                    log.error("Moderation of {}/{} crashed", message.groupId(), message.userId(), error);
                    future.completeExceptionally(error);
                }
            });
        } catch (RejectedExecutionException error) {
            future.completeExceptionally(error);
        }
        return future;
    }

    /**
     * Classifies text the way {@link #moderate} would, without touching the
     * ledger, the statistics or the cooldown gate.
     */
    public ProbeResult probe(String text) throws InterruptedException {
        List<String> localWords = localCheckEnabled ? keywordMatcher.match(text) : List.of();
        if (!localWords.isEmpty()) {
            return new ProbeResult(ModerationOutcome.Status.VIOLATION, ModerationOutcome.Source.LOCAL, localWords);
        }
        Optional<Verdict> verdict = client.get().classify(text);
        if (verdict.isEmpty()) {
            return new ProbeResult(ModerationOutcome.Status.UNKNOWN, ModerationOutcome.Source.REMOTE, List.of());
        }
        ModerationOutcome.Status status = verdict.get().violation()
                ? ModerationOutcome.Status.VIOLATION
                : ModerationOutcome.Status.CLEAN;
        return new ProbeResult(status, ModerationOutcome.Source.REMOTE, verdict.get().matchedTerms());
    }

    private ModerationOutcome escalate(InboundMessage message, List<String> words, ModerationOutcome.Source source)
            throws InterruptedException {
        ViolationLedger.RecordedViolation recorded;
        try {
            recorded = ledger.recordViolation(
                    message.groupId(),
                    message.userId(),
                    message.userName(),
                    words,
                    message.text()
            );
        } catch (LedgerException error) {
            log.error("Dropping moderation decision for {}/{}: ledger write failed",
                    message.groupId(), message.userId(), error);
            return ModerationOutcome.failed(error.getMessage());
        }
        statistics.recordDetection(message.groupId(), message.userId(), words);
        ModerationOutcome.Decision decision = new ModerationOutcome.Decision(
                recorded.tier(),
                recorded.banDurationSeconds(),
                words,
                message.text(),
                source,
                recorded.violationDay()
        );
        log.info("{} violation #{} by {}/{}: {} -> {}s", source, decision.tier(), message.groupId(),
                message.userId(), words, decision.banDurationSeconds());
        return ModerationOutcome.violation(decision);
    }

    /**
     * Periodically expires cache entries, cooldown marks and old ledger rows.
     */
    public void startMaintenance(Duration period) {
        long millis = period.toMillis();
        maintenance.scheduleAtFixedRate(this::runMaintenance, millis, millis, TimeUnit.MILLISECONDS);
    }

    void runMaintenance() {
        int evicted = client.get().cache().evict();
        int stale = cooldownGate.evictStale();
        try {
            ledger.purgeExpired();
        } catch (LedgerException error) {
            log.warn("Scheduled retention cleanup failed: {}", error.getMessage());
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            return;
        }
        log.debug("Maintenance evicted {} cache entries and {} cooldown marks", evicted, stale);
    }

    /**
     * Swaps in a differently configured classification client; in-flight calls
     * finish on the previous instance.
     */
    public ClassificationClient reconfigureClassification(ClassificationClient replacement) {
        ClassificationClient previous = client.getAndSet(replacement);
        log.info("Classification client replaced");
        return previous;
    }

    public KeywordMatcher keywords() {
        return keywordMatcher;
    }

    public ViolationLedger ledger() {
        return ledger;
    }

    public ModerationStatistics statistics() {
        return statistics;
    }

    public StatusSnapshot status() {
        ClassificationClient current = client.get();
        return new StatusSnapshot(
                current.stats(),
                current.limiter().state(),
                current.cache().size(),
                ledger.poolStats(),
                keywordMatcher.size(),
                localCheckEnabled,
                cooldownGate.isEnabled(),
                statistics.snapshot()
        );
    }

    /**
     * Cancels in-flight work by interrupting the workers, then closes the ledger.
     */
    @Override
    public void close() {
        maintenance.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Moderation workers did not stop within {} s", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
        }
        ledger.close();
    }
}
