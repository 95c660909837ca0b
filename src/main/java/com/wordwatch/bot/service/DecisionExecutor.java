package com.wordwatch.bot.service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries a violation decision out on the platform: removes the message and
 * suspends the author unless their role is exempt.
 */
public class DecisionExecutor {
    private static final Logger log = LoggerFactory.getLogger(DecisionExecutor.class);

    public record ExecutionReport(boolean deleted, boolean banned, boolean exempt) {}

    private final boolean deleteEnabled;
    private final Set<String> exemptRoles;
    private final ModerationStatistics statistics;

    public DecisionExecutor(boolean deleteEnabled, List<String> exemptRoles, ModerationStatistics statistics) {
        this.deleteEnabled = deleteEnabled;
        this.exemptRoles = exemptRoles.stream()
                .map(role -> role.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.statistics = statistics;
    }

    public ExecutionReport apply(ModerationEvent event, ModerationOutcome.Decision decision) {
        boolean deleted = deleteEnabled && event.deleteMessage();
        boolean exempt = isExempt(event.getRole());
        boolean banned = false;
        if (decision.banDurationSeconds() > 0 && !exempt) {
            banned = event.setBan(decision.banDurationSeconds());
            if (banned) {
                statistics.recordBan(event.getGroupId(), event.getUserId(), decision.matchedWords());
            } else {
                log.warn("Suspension of {}/{} for {}s was not applied",
                        event.getGroupId(), event.getUserId(), decision.banDurationSeconds());
            }
        }
        return new ExecutionReport(deleted, banned, exempt);
    }

    boolean isExempt(String role) {
        return role != null && exemptRoles.contains(role.toLowerCase(Locale.ROOT));
    }
}
