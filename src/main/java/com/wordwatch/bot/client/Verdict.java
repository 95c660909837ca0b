package com.wordwatch.bot.client;

import java.util.List;

/**
 * Classification outcome for one piece of text. An absent verdict (empty
 * {@code Optional}) means "unknown" and must never be read as clean.
 */
public record Verdict(boolean violation, List<String> matchedTerms) {
    public Verdict {
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
    }

    public static Verdict clean() {
        return new Verdict(false, List.of());
    }

    public static Verdict violation(List<String> matchedTerms) {
        return new Verdict(true, matchedTerms);
    }
}
