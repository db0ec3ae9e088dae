package com.example.filterengine.service;

import com.example.filterengine.store.FilterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class UsageTracker {

    private static final Logger logger = LoggerFactory.getLogger(UsageTracker.class);

    private final FilterStore store;

    public UsageTracker(FilterStore store) {
        this.store = store;
    }

    /**
     * Adds one to the filter's usage count and stamps {@code lastUsedAt}. The
     * increment happens in the store, so concurrent evaluations never lose one.
     */
    public void incrementUsage(String filterId) {
        store.incrementUsage(filterId, Instant.now());
        logger.debug("Usage recorded for filter {}", filterId);
    }
}
