package com.wordwatch.bot.ledger;

import java.time.Duration;

/**
 * No pooled connection became free within the bounded wait. Transient.
 */
public class PoolExhaustedException extends LedgerException {
    public PoolExhaustedException(int maxSize, Duration waited) {
        super("All " + maxSize + " ledger connections busy after " + waited.toMillis() + " ms");
    }
}
