package com.wordwatch.bot.ledger;

import com.wordwatch.bot.config.MonitorConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * Bounded set of reusable SQLite connections. A semaphore caps the number of
 * leases and makes {@link #acquire()} block until one frees up or the wait runs
 * out; the pool lock only guards bookkeeping, never storage work.
 */
public class ConnectionPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    public record PoolStats(int idle, int leased, int created, int maxSize, long exhaustedCount) {}

    /**
     * Scoped lease; closing it hands the connection back to the pool.
     */
    public final class Lease implements AutoCloseable {
        private final Connection connection;

        private Lease(Connection connection) {
            this.connection = connection;
        }

        public Connection connection() {
            return connection;
        }

        @Override
        public void close() {
            release(connection);
        }
    }

    private final ConnectionFactory factory;
    private final int maxSize;
    private final Duration acquireTimeout;
    private final Semaphore permits;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Connection> idle = new ArrayDeque<>();
    private final Set<Connection> leased = Collections.newSetFromMap(new IdentityHashMap<>());
    private final AtomicLong exhaustedCount = new AtomicLong();
    private int created;
    private boolean closed;

    public ConnectionPool(ConnectionFactory factory, int initialSize, int maxSize, Duration acquireTimeout)
            throws SQLException {
        if (maxSize < 1 || initialSize < 0 || initialSize > maxSize) {
            throw new IllegalArgumentException("Pool sizes must satisfy 0 <= initial <= max and max >= 1");
        }
        this.factory = factory;
        this.maxSize = maxSize;
        this.acquireTimeout = acquireTimeout;
        this.permits = new Semaphore(maxSize, true);
        try {
            for (int i = 0; i < initialSize; i++) {
                idle.addLast(factory.open());
                created++;
            }
        } catch (SQLException error) {
            idle.forEach(ConnectionPool::closeQuietly);
            idle.clear();
            created = 0;
            throw error;
        }
    }

    /**
     * Opens a pool over a SQLite file with WAL journaling and NORMAL sync.
     */
    public static ConnectionPool sqlite(Path databaseFile, MonitorConfig.PoolSettings settings)
            throws LedgerException {
        try {
            Path parent = databaseFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException error) {
            throw new LedgerException("Cannot create ledger directory for " + databaseFile, error);
        }
        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqliteConfig.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        String url = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        try {
            return new ConnectionPool(
                    () -> DriverManager.getConnection(url, sqliteConfig.toProperties()),
                    settings.initialSize(),
                    settings.maxSize(),
                    settings.acquireTimeout()
            );
        } catch (SQLException error) {
            throw new LedgerException("Cannot open ledger database " + databaseFile, error);
        }
    }

    /**
     * @throws PoolExhaustedException if nothing frees up within the acquire timeout
     * @throws InterruptedException if cancelled while waiting
     */
    public Connection acquire() throws LedgerException, InterruptedException {
        if (!permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            exhaustedCount.incrementAndGet();
            throw new PoolExhaustedException(maxSize, acquireTimeout);
        }
        Connection reused;
        lock.lock();
        try {
            if (closed) {
                permits.release();
                throw new LedgerException("Connection pool is closed");
            }
            reused = pollUsableIdle();
            if (reused != null) {
                leased.add(reused);
                return reused;
            }
            created++;
        } finally {
            lock.unlock();
        }

        Connection fresh;
        try {
            fresh = factory.open();
        } catch (SQLException error) {
            lock.lock();
            try {
                created--;
            } finally {
                lock.unlock();
            }
            permits.release();
            throw new LedgerException("Cannot open ledger connection", error);
        }
        lock.lock();
        try {
            leased.add(fresh);
        } finally {
            lock.unlock();
        }
        return fresh;
    }

    public Lease lease() throws LedgerException, InterruptedException {
        return new Lease(acquire());
    }

    /**
     * Returns a connection to the pool. Releasing a connection that is not
     * currently leased is a no-op.
     */
    public void release(Connection connection) {
        if (connection == null) {
            return;
        }
        boolean closeNow;
        lock.lock();
        try {
            if (!leased.remove(connection)) {
                return;
            }
            closeNow = closed;
            if (closeNow) {
                created--;
            } else {
                idle.addFirst(connection);
            }
        } finally {
            lock.unlock();
        }
        permits.release();
        if (closeNow) {
            closeQuietly(connection);
        }
    }

    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(idle.size(), leased.size(), created, maxSize, exhaustedCount.get());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        Deque<Connection> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayDeque<>(idle);
            created -= idle.size();
            idle.clear();
        } finally {
            lock.unlock();
        }
        toClose.forEach(ConnectionPool::closeQuietly);
    }

    // Caller holds the lock.
    private Connection pollUsableIdle() {
        Connection candidate;
        while ((candidate = idle.pollFirst()) != null) {
            if (isUsable(candidate)) {
                return candidate;
            }
            created--;
            closeQuietly(candidate);
        }
        return null;
    }

    private static boolean isUsable(Connection connection) {
        try {
            return !connection.isClosed();
        } catch (SQLException error) {
            return false;
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException error) {
            log.warn("Failed to close ledger connection: {}", error.getMessage());
        }
    }
}
