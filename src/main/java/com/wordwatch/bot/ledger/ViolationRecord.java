package com.wordwatch.bot.ledger;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * The open escalation cycle of one (group, user) pair. {@code lastViolationDate}
 * is a violation day, not a calendar date.
 */
public record ViolationRecord(
        String groupId,
        String userId,
        String userName,
        int violationCount,
        List<String> forbiddenWords,
        String originalText,
        long banDurationSeconds,
        LocalDate lastViolationDate,
        Instant createdAt
) {
    public ViolationRecord {
        forbiddenWords = forbiddenWords == null ? List.of() : List.copyOf(forbiddenWords);
    }
}
