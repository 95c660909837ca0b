package com.wordwatch.bot.client;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Verdicts keyed by a digest of the trimmed, case-folded text. Entries expire
 * after a fixed TTL; past capacity the oldest insertions go first.
 */
public class ContentCache {
    private record Entry(Verdict verdict, Instant insertedAt) {}

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    // Insertion order; re-inserting a key moves it to the tail.
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

    public ContentCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public Optional<Verdict> get(String text) {
        String key = keyFor(text);
        lock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (isExpired(entry, clock.instant())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.verdict());
        } finally {
            lock.unlock();
        }
    }

    public void put(String text, Verdict verdict) {
        String key = keyFor(text);
        lock.lock();
        try {
            entries.remove(key);
            entries.put(key, new Entry(verdict, clock.instant()));
            if (entries.size() > maxEntries) {
                evictLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops expired entries, then the oldest insertions until capacity holds.
     *
     * @return number of entries removed
     */
    public int evict() {
        lock.lock();
        try {
            return evictLocked();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private int evictLocked() {
        int removed = 0;
        Instant now = clock.instant();
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (isExpired(iterator.next().getValue(), now)) {
                iterator.remove();
                removed++;
            }
        }
        iterator = entries.entrySet().iterator();
        while (entries.size() > maxEntries && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
            removed++;
        }
        return removed;
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.insertedAt(), now).compareTo(ttl) >= 0;
    }

    static String keyFor(String text) {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException error) {
            throw new IllegalStateException("SHA-256 is not available", error);
        }
    }
}
