package com.wordwatch.bot.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable per-(group, user) escalation state.
 *
 * <p>Each pair keeps a single row for its current cycle. A new violation on the
 * same violation day raises the count by one; a violation on a later day starts
 * over at one. The duration lookup saturates at the third tier while the count
 * keeps growing.
 *
 * <p>Reads never throw: storage trouble degrades to tier one and a warning.
 * Writes propagate {@link LedgerException} because a dropped write would lose
 * escalation.
 */
public class ViolationLedger implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ViolationLedger.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> WORD_LIST = new TypeReference<>() {};

    static final int MAX_TEXT_LENGTH = 500;
    private static final int LOCK_STRIPES = 64;

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS violations (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                group_id TEXT NOT NULL,
                user_id TEXT NOT NULL,
                user_name TEXT,
                violation_count INTEGER NOT NULL DEFAULT 1,
                forbidden_words TEXT,
                original_text TEXT,
                ban_duration INTEGER NOT NULL DEFAULT 0,
                last_violation_date TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                UNIQUE (group_id, user_id)
            )""";
    private static final String CREATE_DATE_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_last_date ON violations(last_violation_date)";
    private static final String SELECT_COLUMNS = "SELECT group_id, user_id, user_name, violation_count, "
            + "forbidden_words, original_text, ban_duration, last_violation_date, created_at FROM violations ";
    private static final String SELECT_LATEST = SELECT_COLUMNS
            + "WHERE group_id = ? AND user_id = ? ORDER BY last_violation_date DESC, created_at DESC LIMIT 1";
    private static final String SELECT_HISTORY = SELECT_COLUMNS
            + "WHERE group_id = ? AND user_id = ? ORDER BY last_violation_date DESC, created_at DESC";
    private static final String SELECT_GROUP = SELECT_COLUMNS
            + "WHERE group_id = ? ORDER BY last_violation_date DESC, created_at DESC LIMIT ?";
    private static final String UPSERT = """
            INSERT INTO violations
                (group_id, user_id, user_name, violation_count, forbidden_words,
                 original_text, ban_duration, last_violation_date, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (group_id, user_id) DO UPDATE SET
                user_name = excluded.user_name,
                violation_count = excluded.violation_count,
                forbidden_words = excluded.forbidden_words,
                original_text = excluded.original_text,
                ban_duration = excluded.ban_duration,
                last_violation_date = excluded.last_violation_date,
                created_at = excluded.created_at""";
    private static final String DELETE_OLDER_THAN = "DELETE FROM violations WHERE last_violation_date < ?";
    private static final String DELETE_PAIR = "DELETE FROM violations WHERE group_id = ? AND user_id = ?";
    private static final String DELETE_GROUP = "DELETE FROM violations WHERE group_id = ?";

    /** Tier the next violation would receive, and the violation day that tier belongs to. */
    public record TierStatus(int tier, LocalDate asOfDate) {}

    public record RecordedViolation(int tier, long banDurationSeconds, LocalDate violationDay) {}

    private final ConnectionPool pool;
    private final BanLadder ladder;
    private final int resetHour;
    private final int retentionDays;
    private final Clock clock;
    private final ReentrantLock[] pairLocks = new ReentrantLock[LOCK_STRIPES];

    public ViolationLedger(ConnectionPool pool, BanLadder ladder, int resetHour, int retentionDays, Clock clock)
            throws LedgerException {
        if (resetHour < 0 || resetHour > 23) {
            throw new IllegalArgumentException("resetHour must be within 0..23");
        }
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be positive");
        }
        this.pool = pool;
        this.ladder = ladder;
        this.resetHour = resetHour;
        this.retentionDays = retentionDays;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            pairLocks[i] = new ReentrantLock();
        }
        initSchema();
    }

    private void initSchema() throws LedgerException {
        try (ConnectionPool.Lease lease = pool.lease();
             Statement statement = lease.connection().createStatement()) {
            statement.execute(CREATE_TABLE);
            statement.execute(CREATE_DATE_INDEX);
        } catch (SQLException error) {
            throw new LedgerException("Cannot initialise violations table", error);
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            throw new LedgerException("Interrupted while initialising violations table", error);
        }
    }

    /**
     * Records a violation and returns the tier it landed on. The read of the
     * previous tier and the write of the new one happen in one immediate
     * transaction, serialised per pair, so concurrent violations never share a tier.
     * Expired rows are purged afterwards on a best-effort basis.
     */
    public RecordedViolation recordViolation(
            String groupId,
            String userId,
            String userName,
            List<String> forbiddenWords,
            String originalText
    ) throws LedgerException, InterruptedException {
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(userId, "userId");
        RecordedViolation recorded;
        ReentrantLock pairLock = lockFor(groupId, userId);
        pairLock.lockInterruptibly();
        try (ConnectionPool.Lease lease = pool.lease()) {
            recorded = upsertInTransaction(lease.connection(), groupId, userId, userName,
                    forbiddenWords, originalText);
        } finally {
            pairLock.unlock();
        }
        log.debug("Recorded violation #{} for {}/{} on {}", recorded.tier(), groupId, userId,
                recorded.violationDay());

        try {
            purgeExpired();
        } catch (LedgerException error) {
            log.warn("Retention cleanup after write failed: {}", error.getMessage());
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            log.warn("Retention cleanup after write interrupted");
        }
        return recorded;
    }

    private RecordedViolation upsertInTransaction(
            Connection connection,
            String groupId,
            String userId,
            String userName,
            List<String> forbiddenWords,
            String originalText
    ) throws LedgerException {
        LocalDate today = currentViolationDay();
        try {
            execute(connection, "BEGIN IMMEDIATE");
        } catch (SQLException error) {
            throw new LedgerException("Cannot open ledger transaction", error);
        }
        try {
            int tier = findLatest(connection, groupId, userId)
                    .filter(previous -> !previous.lastViolationDate().isBefore(today))
                    .map(previous -> previous.violationCount() + 1)
                    .orElse(1);
            long duration = ladder.durationFor(tier);
            try (PreparedStatement statement = connection.prepareStatement(UPSERT)) {
                statement.setString(1, groupId);
                statement.setString(2, userId);
                statement.setString(3, userName);
                statement.setInt(4, tier);
                statement.setString(5, writeWords(forbiddenWords));
                statement.setString(6, truncate(originalText));
                statement.setLong(7, duration);
                statement.setString(8, today.toString());
                statement.setLong(9, clock.millis());
                statement.executeUpdate();
            }
            execute(connection, "COMMIT");
            return new RecordedViolation(tier, duration, today);
        } catch (SQLException | LedgerException error) {
            rollback(connection, error);
            if (error instanceof LedgerException ledgerError) {
                throw ledgerError;
            }
            throw new LedgerException("Failed to record violation for " + groupId + "/" + userId, error);
        }
    }

    /**
     * Tier the next violation of this pair would receive: one when no record
     * exists or its cycle has lapsed, otherwise the stored count plus one.
     * Side-effect free; storage errors fall back to tier one.
     */
    public TierStatus getCurrentTier(String groupId, String userId) {
        LocalDate today = currentViolationDay();
        try (ConnectionPool.Lease lease = pool.lease()) {
            return findLatest(lease.connection(), groupId, userId)
                    .filter(previous -> !previous.lastViolationDate().isBefore(today))
                    .map(previous -> new TierStatus(previous.violationCount() + 1, previous.lastViolationDate()))
                    .orElse(new TierStatus(1, today));
        } catch (SQLException | LedgerException error) {
            log.warn("Tier lookup for {}/{} failed, assuming tier 1: {}", groupId, userId, error.getMessage());
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            log.warn("Tier lookup for {}/{} interrupted, assuming tier 1", groupId, userId);
        }
        return new TierStatus(1, today);
    }

    /** All stored records of a pair, newest first. Empty on storage errors. */
    public List<ViolationRecord> history(String groupId, String userId) {
        return query(SELECT_HISTORY, statement -> {
            statement.setString(1, groupId);
            statement.setString(2, userId);
        });
    }

    public List<ViolationRecord> recentForGroup(String groupId, int limit) {
        return query(SELECT_GROUP, statement -> {
            statement.setString(1, groupId);
            statement.setInt(2, Math.max(1, limit));
        });
    }

    public boolean reset(String groupId, String userId) throws LedgerException, InterruptedException {
        ReentrantLock pairLock = lockFor(groupId, userId);
        pairLock.lockInterruptibly();
        try {
            return update(DELETE_PAIR, statement -> {
                statement.setString(1, groupId);
                statement.setString(2, userId);
            }) > 0;
        } finally {
            pairLock.unlock();
        }
    }

    public int resetGroup(String groupId) throws LedgerException, InterruptedException {
        return update(DELETE_GROUP, statement -> statement.setString(1, groupId));
    }

    /** Deletes records whose violation day is older than the retention window. */
    public int purgeExpired() throws LedgerException, InterruptedException {
        return purgeOlderThan(currentViolationDay().minusDays(retentionDays));
    }

    public int purgeOlderThan(LocalDate cutoff) throws LedgerException, InterruptedException {
        int deleted = update(DELETE_OLDER_THAN, statement -> statement.setString(1, cutoff.toString()));
        if (deleted > 0) {
            log.info("Purged {} violation record(s) older than {}", deleted, cutoff);
        }
        return deleted;
    }

    public LocalDate currentViolationDay() {
        return ViolationDay.current(clock, resetHour);
    }

    public BanLadder ladder() {
        return ladder;
    }

    public ConnectionPool.PoolStats poolStats() {
        return pool.stats();
    }

    @Override
    public void close() {
        pool.close();
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement statement) throws SQLException;
    }

    private List<ViolationRecord> query(String sql, Binder binder) {
        try (ConnectionPool.Lease lease = pool.lease();
             PreparedStatement statement = lease.connection().prepareStatement(sql)) {
            binder.bind(statement);
            List<ViolationRecord> records = new ArrayList<>();
            try (ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    readRow(rows).ifPresent(records::add);
                }
            }
            return records;
        } catch (SQLException | LedgerException error) {
            log.warn("Violation query failed: {}", error.getMessage());
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            log.warn("Violation query interrupted");
        }
        return List.of();
    }

    private int update(String sql, Binder binder) throws LedgerException, InterruptedException {
        try (ConnectionPool.Lease lease = pool.lease();
             PreparedStatement statement = lease.connection().prepareStatement(sql)) {
            binder.bind(statement);
            return statement.executeUpdate();
        } catch (SQLException error) {
            throw new LedgerException("Ledger update failed", error);
        }
    }

    private Optional<ViolationRecord> findLatest(Connection connection, String groupId, String userId)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SELECT_LATEST)) {
            statement.setString(1, groupId);
            statement.setString(2, userId);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next() ? readRow(rows) : Optional.empty();
            }
        }
    }

    private Optional<ViolationRecord> readRow(ResultSet rows) throws SQLException {
        String groupId = rows.getString("group_id");
        String userId = rows.getString("user_id");
        try {
            int count = rows.getInt("violation_count");
            if (count < 1) {
                throw new IllegalArgumentException("violation_count " + count);
            }
            String lastDate = rows.getString("last_violation_date");
            if (lastDate == null) {
                throw new IllegalArgumentException("missing last_violation_date");
            }
            return Optional.of(new ViolationRecord(
                    groupId,
                    userId,
                    rows.getString("user_name"),
                    count,
                    readWords(rows.getString("forbidden_words")),
                    rows.getString("original_text"),
                    rows.getLong("ban_duration"),
                    LocalDate.parse(lastDate),
                    Instant.ofEpochMilli(rows.getLong("created_at"))
            ));
        } catch (DateTimeParseException | JsonProcessingException | IllegalArgumentException error) {
            log.warn("Ignoring corrupt violation record for {}/{}: {}", groupId, userId, error.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> readWords(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return MAPPER.readValue(json, WORD_LIST);
    }

    private static String writeWords(List<String> words) throws LedgerException {
        try {
            return MAPPER.writeValueAsString(words == null ? List.of() : words);
        } catch (JsonProcessingException error) {
            throw new LedgerException("Cannot serialise forbidden words", error);
        }
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= MAX_TEXT_LENGTH) {
            return text;
        }
        int end = MAX_TEXT_LENGTH;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static void execute(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            execute(connection, "ROLLBACK");
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            log.warn("Rollback failed: {}", rollbackError.getMessage());
        }
    }

    private ReentrantLock lockFor(String groupId, String userId) {
        return pairLocks[Math.floorMod(Objects.hash(groupId, userId), LOCK_STRIPES)];
    }
}
