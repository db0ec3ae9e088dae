package com.example.filterengine.store;

import com.example.filterengine.error.PersistenceException;
import com.example.filterengine.model.FilterRun;
import com.example.filterengine.model.SavedFilter;
import com.example.filterengine.repo.FilterRunRepo;
import com.example.filterengine.repo.SavedFilterRepo;
import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoFilterStore implements FilterStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoFilterStore.class);

    private final MongoTemplate mongo;
    private final SavedFilterRepo filterRepo;
    private final FilterRunRepo runRepo;
    private final TransactionTemplate transactionTemplate;

    @Value("${app.mongo.transaction-max-attempts:5}")
    private int transactionMaxAttempts = 5;

    public MongoFilterStore(MongoTemplate mongo, SavedFilterRepo filterRepo, FilterRunRepo runRepo,
                            ObjectProvider<TransactionTemplate> transactionTemplate) {
        this.mongo = mongo;
        this.filterRepo = filterRepo;
        this.runRepo = runRepo;
        this.transactionTemplate = transactionTemplate.getIfAvailable();
    }

    @Override
    public Optional<SavedFilter> findFilter(String filterId) {
        try {
            return filterRepo.findById(filterId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load filter " + filterId, e);
        }
    }

    @Override
    public void insertRun(FilterRun run) {
        try {
            mongo.insert(run);
            logger.debug("Run {} inserted for filter {}", run.getId(), run.getFilterId());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to insert run " + run.getId(), e);
        }
    }

    @Override
    public void incrementUsage(String filterId, Instant usedAt) {
        Query byId = Query.query(Criteria.where("_id").is(filterId));
        Update update = new Update().inc("usageCount", 1).set("lastUsedAt", usedAt);
        UpdateResult result;
        try {
            result = mongo.updateFirst(byId, update, SavedFilter.class);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to update usage for filter " + filterId, e);
        }
        if (result.getMatchedCount() == 0) {
            throw new PersistenceException("Filter " + filterId + " disappeared before its usage could be recorded");
        }
    }

    /**
     * Runs {@code work} in a Mongo transaction when one is configured. Concurrent
     * transactions touching the same filter abort each other with a
     * {@code TransientTransactionError}; the whole unit is then retried up to
     * {@code app.mongo.transaction-max-attempts} times.
     */
    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (transactionTemplate == null) {
            return work.get();
        }
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (RuntimeException e) {
                if (attempt >= transactionMaxAttempts || !isTransientTransactionError(e)) {
                    throw e;
                }
                logger.warn("Transient transaction error (attempt {}/{}), retrying: {}",
                        attempt, transactionMaxAttempts, e.getMessage());
            }
        }
    }

    static boolean isTransientTransactionError(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof MongoException
                    && ((MongoException) cause).hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Optional<FilterRun> findRun(String filterId, String runId) {
        try {
            return runRepo.findByIdAndFilterId(runId, filterId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load run " + runId, e);
        }
    }

    @Override
    public RunPage findRuns(String filterId, int page, int pageSize) {
        Sort newestFirst = Sort.by(Sort.Direction.DESC, "executedAt").and(Sort.by(Sort.Direction.DESC, "_id"));
        try {
            Page<FilterRun> runs = runRepo.findByFilterId(filterId, PageRequest.of(page - 1, pageSize, newestFirst));
            return new RunPage(runs.getContent(), runs.getTotalElements(), page, pageSize);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to list runs for filter " + filterId, e);
        }
    }
}
