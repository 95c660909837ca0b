package com.wordwatch.bot.service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide moderation counters. Kept in memory only and lost on restart;
 * nothing downstream depends on them for correctness.
 */
public class ModerationStatistics {
    public record Counter(long total, long bans) {}

    public record GroupCounter(long total, long bans, int distinctUsers) {}

    public record Snapshot(
            long totalChecks,
            long detected,
            long autoBans,
            Map<String, GroupCounter> byGroup,
            Map<String, Counter> byUser,
            Map<String, Counter> byWord
    ) {
        public List<Map.Entry<String, Counter>> topWords(int limit) {
            return top(byWord, limit);
        }

        public List<Map.Entry<String, Counter>> topUsers(int limit) {
            return top(byUser, limit);
        }

        private static List<Map.Entry<String, Counter>> top(Map<String, Counter> counters, int limit) {
            return counters.entrySet().stream()
                    .sorted(Comparator.comparingLong((Map.Entry<String, Counter> entry) -> entry.getValue().total())
                            .reversed()
                            .thenComparing(Map.Entry::getKey))
                    .limit(Math.max(0, limit))
                    .map(entry -> Map.entry(entry.getKey(), entry.getValue()))
                    .toList();
        }
    }

    private static final class MutableCounter {
        long total;
        long bans;
    }

    private static final class MutableGroup {
        long total;
        long bans;
        final Set<String> users = new HashSet<>();
    }

    private final boolean enabled;
    private long totalChecks;
    private long detected;
    private long autoBans;
    private final Map<String, MutableGroup> byGroup = new HashMap<>();
    private final Map<String, MutableCounter> byUser = new HashMap<>();
    private final Map<String, MutableCounter> byWord = new HashMap<>();

    public ModerationStatistics(boolean enabled) {
        this.enabled = enabled;
    }

    public synchronized void recordCheck() {
        if (enabled) {
            totalChecks++;
        }
    }

    public synchronized void recordDetection(String groupId, String userId, List<String> words) {
        if (!enabled) {
            return;
        }
        detected++;
        MutableGroup group = byGroup.computeIfAbsent(groupId, ignored -> new MutableGroup());
        group.total++;
        group.users.add(userId);
        byUser.computeIfAbsent(userKey(groupId, userId), ignored -> new MutableCounter()).total++;
        for (String word : words) {
            byWord.computeIfAbsent(word, ignored -> new MutableCounter()).total++;
        }
    }

    public synchronized void recordBan(String groupId, String userId, List<String> words) {
        if (!enabled) {
            return;
        }
        autoBans++;
        byGroup.computeIfAbsent(groupId, ignored -> new MutableGroup()).bans++;
        byUser.computeIfAbsent(userKey(groupId, userId), ignored -> new MutableCounter()).bans++;
        for (String word : words) {
            byWord.computeIfAbsent(word, ignored -> new MutableCounter()).bans++;
        }
    }

    public synchronized Snapshot snapshot() {
        Map<String, GroupCounter> groups = new HashMap<>();
        byGroup.forEach((key, value) -> groups.put(key, new GroupCounter(value.total, value.bans, value.users.size())));
        return new Snapshot(totalChecks, detected, autoBans, Map.copyOf(groups), copy(byUser), copy(byWord));
    }

    public synchronized void reset() {
        totalChecks = 0;
        detected = 0;
        autoBans = 0;
        byGroup.clear();
        byUser.clear();
        byWord.clear();
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static Map<String, Counter> copy(Map<String, MutableCounter> source) {
        Map<String, Counter> result = new HashMap<>();
        source.forEach((key, value) -> result.put(key, new Counter(value.total, value.bans)));
        return Map.copyOf(result);
    }

    private static String userKey(String groupId, String userId) {
        return groupId + ":" + userId;
    }
}
