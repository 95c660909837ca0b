package com.wordwatch.bot.client;

/**
 * The raw network call to the external classification service, without caching,
 * rate limiting or retries.
 */
public interface UpstreamClassifier {
    Verdict classify(String text) throws UpstreamException, InterruptedException;
}
