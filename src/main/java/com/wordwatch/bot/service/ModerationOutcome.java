package com.wordwatch.bot.service;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of moderating one message. Only {@link Status#VIOLATION} carries a
 * decision; {@link Status#UNKNOWN} means no action must be taken.
 */
public record ModerationOutcome(Status status, Decision decision, String detail) {
    public enum Status {
        CLEAN,
        UNKNOWN,
        VIOLATION,
        SKIPPED,
        FAILED
    }

    public enum Source {
        LOCAL,
        REMOTE
    }

    public record Decision(
            int tier,
            long banDurationSeconds,
            List<String> matchedWords,
            String sourceText,
            Source source,
            LocalDate violationDay
    ) {
        public Decision {
            matchedWords = List.copyOf(matchedWords);
        }

        public boolean severe() {
            return tier >= 3;
        }
    }

    static ModerationOutcome clean() {
        return new ModerationOutcome(Status.CLEAN, null, "no violation");
    }

    static ModerationOutcome unknown(String detail) {
        return new ModerationOutcome(Status.UNKNOWN, null, detail);
    }

    static ModerationOutcome skipped(String detail) {
        return new ModerationOutcome(Status.SKIPPED, null, detail);
    }

    static ModerationOutcome failed(String detail) {
        return new ModerationOutcome(Status.FAILED, null, detail);
    }

    static ModerationOutcome violation(Decision decision) {
        return new ModerationOutcome(Status.VIOLATION, decision, "violation #" + decision.tier());
    }

    public boolean isViolation() {
        return status == Status.VIOLATION;
    }
}
