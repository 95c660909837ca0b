package com.wordwatch.bot.ledger;

/**
 * Storage failure on the ledger write path. Callers decide whether to retry the
 * whole moderation decision or drop it explicitly.
 */
public class LedgerException extends Exception {
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
