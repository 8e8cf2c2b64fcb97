package com.corpusindex.embed;

public record RetryPolicy(int maxRetries, long initialBackoffMs, long maxBackoffMs) {

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay before retry number {@code attempt} (1-based): doubles per attempt, capped.
     */
    public long backoffMs(int attempt) {
        long backoff = initialBackoffMs;
        for (int i = 1; i < attempt && backoff < maxBackoffMs; i++) {
            backoff *= 2;
        }
        return Math.min(backoff, maxBackoffMs);
    }
}
