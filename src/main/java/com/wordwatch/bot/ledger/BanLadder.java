package com.wordwatch.bot.ledger;

/**
 * Suspension length per tier, in seconds. Tiers past the third reuse the third duration.
 */
public record BanLadder(long firstSeconds, long secondSeconds, long thirdSeconds) {
    public BanLadder {
        if (firstSeconds < 0 || secondSeconds < 0 || thirdSeconds < 0) {
            throw new IllegalArgumentException("Ban durations must not be negative");
        }
    }

    public static BanLadder disabled() {
        return new BanLadder(0, 0, 0);
    }

    public long durationFor(int tier) {
        if (tier <= 1) {
            return firstSeconds;
        }
        if (tier == 2) {
            return secondSeconds;
        }
        return thirdSeconds;
    }
}
