package com.example.filterengine.store;

import com.example.filterengine.error.PersistenceException;
import com.example.filterengine.model.FilterRun;
import com.example.filterengine.model.RuleClause;
import com.example.filterengine.model.SavedFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-local store for local runs and tests. Usage increments are atomic per
 * filter; {@link #inTransaction} discards runs inserted by work that fails.
 */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryFilterStore implements FilterStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryFilterStore.class);

    private final Map<String, SavedFilter> filters = new ConcurrentHashMap<>();
    private final Map<String, FilterRun> runs = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final ThreadLocal<List<String>> pendingRuns = new ThreadLocal<>();

    /**
     * Stands in for the CRUD layer: creates or replaces a filter definition.
     */
    public void putFilter(SavedFilter filter) {
        filters.put(filter.getId(), copyOf(filter));
    }

    @Override
    public Optional<SavedFilter> findFilter(String filterId) {
        return Optional.ofNullable(filters.get(filterId)).map(InMemoryFilterStore::copyOf);
    }

    @Override
    public void insertRun(FilterRun run) {
        if (runs.putIfAbsent(run.getId(), run) != null) {
            throw new PersistenceException("Run " + run.getId() + " already exists");
        }
        List<String> pending = pendingRuns.get();
        if (pending != null) {
            pending.add(run.getId());
        }
    }

    @Override
    public void incrementUsage(String filterId, Instant usedAt) {
        SavedFilter updated = filters.computeIfPresent(filterId, (id, current) -> current.toBuilder()
                .usageCount(current.getUsageCount() + 1)
                .lastUsedAt(usedAt)
                .build());
        if (updated == null) {
            throw new PersistenceException("Filter " + filterId + " disappeared before its usage could be recorded");
        }
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        writeLock.lock();
        pendingRuns.set(new ArrayList<>());
        try {
            return work.get();
        } catch (RuntimeException e) {
            List<String> inserted = pendingRuns.get();
            inserted.forEach(runs::remove);
            logger.debug("Rolled back {} run(s) after failure: {}", inserted.size(), e.getMessage());
            throw e;
        } finally {
            pendingRuns.remove();
            writeLock.unlock();
        }
    }

    @Override
    public Optional<FilterRun> findRun(String filterId, String runId) {
        return Optional.ofNullable(runs.get(runId)).filter(run -> run.getFilterId().equals(filterId));
    }

    @Override
    public RunPage findRuns(String filterId, int page, int pageSize) {
        List<FilterRun> all = runs.values().stream()
                .filter(run -> run.getFilterId().equals(filterId))
                .sorted(Comparator.comparing(FilterRun::getExecutedAt).reversed()
                        .thenComparing(FilterRun::getId, Comparator.reverseOrder()))
                .collect(Collectors.toList());
        int from = Math.min((page - 1) * pageSize, all.size());
        int to = Math.min(from + pageSize, all.size());
        return new RunPage(List.copyOf(all.subList(from, to)), all.size(), page, pageSize);
    }

    private static SavedFilter copyOf(SavedFilter filter) {
        List<RuleClause> rules = filter.getRules() == null ? null : filter.getRules().stream()
                .map(clause -> clause == null ? null : clause.deepCopy())
                .collect(Collectors.toCollection(ArrayList::new));
        return filter.toBuilder().rules(rules).build();
    }
}
