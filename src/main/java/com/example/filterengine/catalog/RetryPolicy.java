package com.example.filterengine.catalog;

import com.example.filterengine.error.CatalogUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff (delay doubles after each failed attempt).
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialDelay;

    public RetryPolicy(int maxAttempts, Duration initialDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        long delayMs = initialDelay.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts) {
                    logger.error("{} failed after {} attempts", operation, attempt, e);
                    throw new CatalogUnavailableException(operation + " failed after " + attempt + " attempts", e);
                }
                logger.warn("{} failed (attempt {}/{}), retrying in {}ms: {}", operation, attempt, maxAttempts, delayMs, e.getMessage());
                sleep(operation, delayMs, e);
                delayMs = delayMs * 2;
            }
        }
    }

    private static void sleep(String operation, long delayMs, RuntimeException cause) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CatalogUnavailableException(operation + " interrupted while backing off", cause);
        }
    }
}
