package com.williamcallahan.agentknowledge.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Hybrid search settings.
 */
public class SearchSettings {

    private static final int DEFAULT_TOP_K_DEF = 10;
    private static final int MAX_TOP_K_DEF = 50;
    private static final int MAX_TOP_K_CEILING = 50;
    private static final int CANDIDATE_FLOOR_DEF = 20;
    private static final int RRF_K_DEF = 60;
    private static final Duration QUERY_TIMEOUT_DEF = Duration.ofSeconds(30);
    private static final int FAN_OUT_THREADS_DEF = 8;
    private static final String DEFAULT_TOP_K_KEY = "app.search.default-top-k";
    private static final String MAX_TOP_K_KEY = "app.search.max-top-k";
    private static final String CANDIDATE_FLOOR_KEY = "app.search.candidate-floor";
    private static final String RRF_K_KEY = "app.search.rrf-k";
    private static final String QUERY_TIMEOUT_KEY = "app.search.query-timeout";
    private static final String FAN_OUT_THREADS_KEY = "app.search.fan-out-threads";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String TOP_K_CEILING_MSG = "%s must be at most %d (got %d).";
    private static final String TOP_K_BOUND_MSG = "%s must be less than or equal to %s (got %d > %d).";

    private int defaultTopK = DEFAULT_TOP_K_DEF;
    private int maxTopK = MAX_TOP_K_DEF;
    private int candidateFloor = CANDIDATE_FLOOR_DEF;
    private int rrfK = RRF_K_DEF;
    private Duration queryTimeout = QUERY_TIMEOUT_DEF;
    private int fanOutThreads = FAN_OUT_THREADS_DEF;

    public SearchSettings() {}

    /**
     * Validates search settings.
     */
    public void validateConfiguration() {
        requirePositive(DEFAULT_TOP_K_KEY, defaultTopK);
        requirePositive(MAX_TOP_K_KEY, maxTopK);
        requirePositive(CANDIDATE_FLOOR_KEY, candidateFloor);
        requirePositive(FAN_OUT_THREADS_KEY, fanOutThreads);
        if (rrfK < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, RRF_K_KEY));
        }
        if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, QUERY_TIMEOUT_KEY));
        }
        if (maxTopK > MAX_TOP_K_CEILING) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, TOP_K_CEILING_MSG, MAX_TOP_K_KEY, MAX_TOP_K_CEILING, maxTopK));
        }
        if (defaultTopK > maxTopK) {
            throw new IllegalArgumentException(String.format(
                    Locale.ROOT, TOP_K_BOUND_MSG, DEFAULT_TOP_K_KEY, MAX_TOP_K_KEY, defaultTopK, maxTopK));
        }
    }

    private static void requirePositive(String propertyKey, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(final int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getMaxTopK() {
        return maxTopK;
    }

    public void setMaxTopK(final int maxTopK) {
        this.maxTopK = maxTopK;
    }

    /**
     * Minimum number of candidates fetched from each ranked list before fusion.
     */
    public int getCandidateFloor() {
        return candidateFloor;
    }

    public void setCandidateFloor(final int candidateFloor) {
        this.candidateFloor = candidateFloor;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(final int rrfK) {
        this.rrfK = rrfK;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(final Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public int getFanOutThreads() {
        return fanOutThreads;
    }

    public void setFanOutThreads(final int fanOutThreads) {
        this.fanOutThreads = fanOutThreads;
    }
}
