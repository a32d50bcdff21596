package com.williamcallahan.agentknowledge.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Retry settings for transient knowledge store failures.
 */
public class RetrySettings {

    private static final int MAX_ATTEMPTS_DEF = 3;
    private static final Duration INITIAL_BACKOFF_DEF = Duration.ofMillis(500);
    private static final String MAX_ATTEMPTS_KEY = "app.retry.max-attempts";
    private static final String INITIAL_BACKOFF_KEY = "app.retry.initial-backoff";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";

    private int maxAttempts = MAX_ATTEMPTS_DEF;
    private Duration initialBackoff = INITIAL_BACKOFF_DEF;

    public RetrySettings() {}

    /**
     * Validates retry settings.
     */
    public void validateConfiguration() {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_ATTEMPTS_KEY));
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, INITIAL_BACKOFF_KEY));
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(final int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(final Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }
}
