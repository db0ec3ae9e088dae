package com.example.filterengine.store;

import com.example.filterengine.model.FilterRun;
import com.example.filterengine.model.SavedFilter;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Storage for the evaluation path: live filter lookup, the append-only run
 * history and the usage counters. Implementations throw
 * {@link com.example.filterengine.error.PersistenceException} when a write does not complete.
 */
public interface FilterStore {

    Optional<SavedFilter> findFilter(String filterId);

    /**
     * Inserts a new run. Fails if a run with the same id already exists.
     */
    void insertRun(FilterRun run);

    /**
     * Atomically adds one to {@code usageCount} and sets {@code lastUsedAt}.
     * Fails if the filter no longer exists.
     */
    void incrementUsage(String filterId, Instant usedAt);

    /**
     * Runs {@code work} so that its writes commit or fail together where the
     * backing store supports it.
     */
    <T> T inTransaction(Supplier<T> work);

    Optional<FilterRun> findRun(String filterId, String runId);

    /**
     * Newest runs first; {@code page} is 1-based.
     */
    RunPage findRuns(String filterId, int page, int pageSize);
}
