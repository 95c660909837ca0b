package com.wordwatch.bot.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.wordwatch.bot.MutableClock;
import com.wordwatch.bot.config.MonitorConfig;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ViolationLedgerTest {
    private static final List<String> WORDS = List.of("badword");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ConnectionPool pool;
    private ViolationLedger ledger;

    @BeforeEach
    void openLedger() throws LedgerException {
        clock = MutableClock.at("2026-03-10T12:00:00");
        pool = ConnectionPool.sqlite(
                tempDir.resolve("violations.db"),
                new MonitorConfig.PoolSettings(1, 4, Duration.ofSeconds(10))
        );
        ledger = new ViolationLedger(pool, new BanLadder(60, 600, 86400), 4, 30, clock);
    }

    @AfterEach
    void closeLedger() {
        ledger.close();
    }

    private ViolationLedger.RecordedViolation record(String groupId, String userId) throws Exception {
        return ledger.recordViolation(groupId, userId, "user-" + userId, WORDS, "some text");
    }

    @Test
    void escalatesThroughTheLadderAndSaturates() throws Exception {
        ViolationLedger.RecordedViolation first = record("g1", "u1");
        ViolationLedger.RecordedViolation second = record("g1", "u1");
        ViolationLedger.RecordedViolation third = record("g1", "u1");
        ViolationLedger.RecordedViolation fourth = record("g1", "u1");

        assertEquals(new ViolationLedger.RecordedViolation(1, 60, LocalDate.of(2026, 3, 10)), first);
        assertEquals(2, second.tier());
        assertEquals(600, second.banDurationSeconds());
        assertEquals(3, third.tier());
        assertEquals(86400, third.banDurationSeconds());
        assertEquals(4, fourth.tier());
        assertEquals(86400, fourth.banDurationSeconds());
    }

    @Test
    void pairsEscalateIndependently() throws Exception {
        record("g1", "u1");
        record("g1", "u1");

        assertEquals(1, record("g1", "u2").tier());
        assertEquals(1, record("g2", "u1").tier());
        assertEquals(3, record("g1", "u1").tier());
    }

    @Test
    void cycleStartsOverOnTheNextViolationDay() throws Exception {
        record("g1", "u1");
        record("g1", "u1");

        clock.set("2026-03-11T09:00:00");
        ViolationLedger.RecordedViolation next = record("g1", "u1");

        assertEquals(1, next.tier());
        assertEquals(60, next.banDurationSeconds());
        assertEquals(LocalDate.of(2026, 3, 11), next.violationDay());
    }

    @Test
    void violationBeforeResetHourBelongsToPreviousDay() throws Exception {
        clock.set("2026-03-10T03:00:00");
        ViolationLedger.RecordedViolation early = record("g1", "u1");
        assertEquals(LocalDate.of(2026, 3, 9), early.violationDay());

        clock.set("2026-03-10T05:00:00");
        ViolationLedger.RecordedViolation later = record("g1", "u1");

        assertEquals(1, later.tier());
        assertEquals(LocalDate.of(2026, 3, 10), later.violationDay());
    }

    @Test
    void violationsAfterResetHourShareTheDay() throws Exception {
        clock.set("2026-03-10T04:30:00");
        record("g1", "u1");

        clock.set("2026-03-10T05:00:00");
        ViolationLedger.RecordedViolation later = record("g1", "u1");

        assertEquals(2, later.tier());
        assertEquals(600, later.banDurationSeconds());
    }

    @Test
    void lateNightAndEarlyMorningShareTheDay() throws Exception {
        clock.set("2026-03-10T23:30:00");
        record("g1", "u1");

        clock.set("2026-03-11T03:59:00");
        assertEquals(2, record("g1", "u1").tier());

        clock.set("2026-03-11T04:00:00");
        assertEquals(1, record("g1", "u1").tier());
    }

    @Test
    void currentTierIsTheNextTierAndHasNoSideEffects() throws Exception {
        assertEquals(new ViolationLedger.TierStatus(1, LocalDate.of(2026, 3, 10)), ledger.getCurrentTier("g1", "u1"));
        assertEquals(1, ledger.getCurrentTier("g1", "u1").tier());
        assertTrue(ledger.history("g1", "u1").isEmpty());

        record("g1", "u1");
        record("g1", "u1");
        assertEquals(3, ledger.getCurrentTier("g1", "u1").tier());
        assertEquals(3, ledger.getCurrentTier("g1", "u1").tier());
        assertEquals(3, record("g1", "u1").tier());

        clock.set("2026-03-11T12:00:00");
        assertEquals(new ViolationLedger.TierStatus(1, LocalDate.of(2026, 3, 11)), ledger.getCurrentTier("g1", "u1"));
    }

    @Test
    void concurrentViolationsOnOnePairNeverShareATier() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ViolationLedger.RecordedViolation>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return record("g1", "u1");
                }));
            }
            start.countDown();

            Set<Integer> tiers = new TreeSet<>();
            for (Future<ViolationLedger.RecordedViolation> future : futures) {
                tiers.add(future.get(30, TimeUnit.SECONDS).tier());
            }
            assertEquals(IntStream.rangeClosed(1, threads).boxed().collect(Collectors.toSet()), tiers);
            assertEquals(threads + 1, ledger.getCurrentTier("g1", "u1").tier());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentViolationsAcrossPairsStayConsistent() throws Exception {
        int pairs = 4;
        int perPair = 5;
        ExecutorService executor = Executors.newFixedThreadPool(pairs * perPair);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ViolationLedger.RecordedViolation>> futures = new ArrayList<>();
            for (int pair = 0; pair < pairs; pair++) {
                String userId = "u" + pair;
                for (int i = 0; i < perPair; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return record("g1", userId);
                    }));
                }
            }
            start.countDown();
            for (Future<ViolationLedger.RecordedViolation> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            for (int pair = 0; pair < pairs; pair++) {
                assertEquals(perPair + 1, ledger.getCurrentTier("g1", "u" + pair).tier());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void purgeRemovesOnlyRecordsPastRetention() throws Exception {
        clock.set("2026-02-01T12:00:00");
        record("g1", "old");
        clock.set("2026-02-20T12:00:00");
        record("g1", "recent");
        clock.set("2026-02-08T12:00:00");
        record("g1", "edge");

        clock.set("2026-03-10T12:00:00");
        assertEquals(1, ledger.purgeExpired());

        assertTrue(ledger.history("g1", "old").isEmpty());
        assertEquals(1, ledger.history("g1", "recent").size());
        assertEquals(1, ledger.history("g1", "edge").size());
        assertEquals(0, ledger.purgeExpired());
    }

    @Test
    void writesPurgeExpiredRecordsAfterwards() throws Exception {
        clock.set("2026-01-15T12:00:00");
        record("g1", "old");

        clock.set("2026-03-10T12:00:00");
        record("g1", "fresh");

        assertTrue(ledger.history("g1", "old").isEmpty());
        assertEquals(1, ledger.history("g1", "fresh").size());
    }

    @Test
    void corruptRecordIsTreatedAsNoRecord() throws Exception {
        try (ConnectionPool.Lease lease = pool.lease();
             PreparedStatement insert = lease.connection().prepareStatement(
                     "INSERT INTO violations (group_id, user_id, violation_count, last_violation_date, created_at) "
                             + "VALUES ('g1', 'u1', 2, 'not-a-date', 0)")) {
            insert.executeUpdate();
        }

        assertEquals(1, ledger.getCurrentTier("g1", "u1").tier());
        assertTrue(ledger.history("g1", "u1").isEmpty());

        assertEquals(1, record("g1", "u1").tier());
        assertEquals(2, ledger.getCurrentTier("g1", "u1").tier());
    }

    @Test
    void storesRecordDetailsAndTruncatesText() throws Exception {
        String longText = "x".repeat(ViolationLedger.MAX_TEXT_LENGTH + 100);
        ledger.recordViolation("g1", "u1", "Alice", List.of("foo", "bar"), longText);

        List<ViolationRecord> history = ledger.history("g1", "u1");
        assertEquals(1, history.size());
        ViolationRecord stored = history.get(0);
        assertEquals("Alice", stored.userName());
        assertEquals(List.of("foo", "bar"), stored.forbiddenWords());
        assertEquals(ViolationLedger.MAX_TEXT_LENGTH, stored.originalText().length());
        assertEquals(60, stored.banDurationSeconds());
        assertEquals(LocalDate.of(2026, 3, 10), stored.lastViolationDate());
        assertEquals(clock.instant(), stored.createdAt());
    }

    @Test
    void recentForGroupListsNewestFirst() throws Exception {
        clock.set("2026-03-08T12:00:00");
        record("g1", "u1");
        clock.set("2026-03-10T12:00:00");
        record("g1", "u2");
        clock.set("2026-03-09T12:00:00");
        record("g1", "u3");
        record("g2", "u4");

        List<String> users = ledger.recentForGroup("g1", 10).stream()
                .map(ViolationRecord::userId)
                .toList();
        assertEquals(List.of("u2", "u3", "u1"), users);
        assertEquals(2, ledger.recentForGroup("g1", 2).size());
    }

    @Test
    void resetClearsOnePairOrAWholeGroup() throws Exception {
        record("g1", "u1");
        record("g1", "u1");
        record("g1", "u2");
        record("g2", "u1");

        assertTrue(ledger.reset("g1", "u1"));
        assertFalse(ledger.reset("g1", "u1"));
        assertEquals(1, ledger.getCurrentTier("g1", "u1").tier());

        assertEquals(1, ledger.resetGroup("g1"));
        assertTrue(ledger.recentForGroup("g1", 10).isEmpty());
        assertEquals(2, ledger.getCurrentTier("g2", "u1").tier());
    }

    @Test
    void interruptedWriterRecordsNothing() {
        Thread.currentThread().interrupt();
        assertThrows(InterruptedException.class, () -> record("g1", "u1"));
        assertTrue(ledger.history("g1", "u1").isEmpty());
    }

    @Test
    void closedLedgerFailsWritesButDegradesReads() {
        ledger.close();

        assertThrows(LedgerException.class, () -> record("g1", "u1"));
        assertEquals(1, ledger.getCurrentTier("g1", "u1").tier());
        assertTrue(ledger.history("g1", "u1").isEmpty());
    }

    @Test
    void disabledLadderStillCountsTiers() throws Exception {
        ledger.close();
        pool = ConnectionPool.sqlite(
                tempDir.resolve("disabled.db"),
                new MonitorConfig.PoolSettings(1, 2, Duration.ofSeconds(5))
        );
        ledger = new ViolationLedger(pool, BanLadder.disabled(), 4, 30, clock);

        record("g1", "u1");
        ViolationLedger.RecordedViolation second = record("g1", "u1");
        assertEquals(2, second.tier());
        assertEquals(0, second.banDurationSeconds());
    }
}
