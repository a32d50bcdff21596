package com.williamcallahan.agentknowledge.support;

import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry utility for transient store failures.
 *
 * <p>Provides exponential backoff retry for operations that may fail transiently.
 * Only retries when {@link TransientFailureClassifier} determines the failure is transient.
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Default backoff multiplier. */
    private static final double DEFAULT_MULTIPLIER = 2.0;
    /** Maximum backoff duration to prevent excessive waits. */
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private RetrySupport() {}

    /**
     * Executes a supplier with configurable retry for transient failures.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param maxAttempts maximum number of attempts, at least 1
     * @param initialBackoff initial backoff duration
     * @param <T> return type
     * @return the result of the operation
     * @throws RuntimeException the last failure when retries are exhausted, or the first non-transient one
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation, String operationName, int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Duration currentBackoff = initialBackoff;

        for (int attempt = 1; ; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                if (!TransientFailureClassifier.isTransient(exception)) {
                    throw exception;
                }
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts, giving up", operationName, maxAttempts);
                    throw exception;
                }
                log.warn(
                        "{} failed with transient error on attempt {}/{}, retrying in {}ms",
                        operationName,
                        attempt,
                        maxAttempts,
                        currentBackoff.toMillis());
                sleep(currentBackoff);
                long nextBackoffMillis = (long) (currentBackoff.toMillis() * DEFAULT_MULTIPLIER);
                currentBackoff = Duration.ofMillis(Math.min(nextBackoffMillis, MAX_BACKOFF.toMillis()));
            }
        }
    }

    private static void sleep(Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
