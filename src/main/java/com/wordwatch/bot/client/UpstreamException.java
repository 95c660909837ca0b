package com.wordwatch.bot.client;

/**
 * Transport failure or non-2xx answer from the classification service.
 */
public class UpstreamException extends Exception {
    public static final int TRANSPORT_FAILURE = -1;

    private final int statusCode;

    public UpstreamException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = TRANSPORT_FAILURE;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isThrottled() {
        return statusCode == 429;
    }
}
