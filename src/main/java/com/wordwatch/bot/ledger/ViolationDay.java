package com.wordwatch.bot.ledger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * The accounting day of a violation. A day starts at the reset hour, so anything
 * before that hour still belongs to the previous calendar date.
 */
public final class ViolationDay {
    private ViolationDay() {
    }

    public static LocalDate of(LocalDateTime time, int resetHour) {
        if (resetHour < 0 || resetHour > 23) {
            throw new IllegalArgumentException("resetHour must be within 0..23");
        }
        LocalDate date = time.toLocalDate();
        return time.getHour() < resetHour ? date.minusDays(1) : date;
    }

    public static LocalDate current(Clock clock, int resetHour) {
        return of(LocalDateTime.now(clock), resetHour);
    }
}
