package com.example.filterengine.service;

import com.example.filterengine.access.CallerContext;
import com.example.filterengine.access.FilterAccessPolicy;
import com.example.filterengine.catalog.ModelCatalog;
import com.example.filterengine.error.CatalogUnavailableException;
import com.example.filterengine.error.ErrorKind;
import com.example.filterengine.error.EvaluationError;
import com.example.filterengine.error.Outcome;
import com.example.filterengine.error.PersistenceException;
import com.example.filterengine.evaluation.EvaluationResults;
import com.example.filterengine.evaluation.FilterEvaluator;
import com.example.filterengine.model.*;
import com.example.filterengine.store.FilterStore;
import com.example.filterengine.store.RunPage;
import com.example.filterengine.validation.RuleClauseValidator;
import com.mongodb.MongoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Evaluates saved filters against the model catalog, records each evaluation as
 * a run and bumps the filter's usage counter. Also serves the run history.
 *
 * <p>Checks happen in a fixed order: request shape, filter lookup, access, rule
 * validation, then catalog. The catalog is never queried for a caller who may
 * not see the filter.
 */
@Service
public class FilterEvaluationService {

    private static final Logger logger = LoggerFactory.getLogger(FilterEvaluationService.class);

    private final FilterStore store;
    private final FilterAccessPolicy accessPolicy;
    private final RuleClauseValidator validator;
    private final ModelCatalog modelCatalog;
    private final FilterEvaluator evaluator;
    private final RunRecorder runRecorder;
    private final UsageTracker usageTracker;
    private final RequestParser requestParser;

    public FilterEvaluationService(FilterStore store,
                                   FilterAccessPolicy accessPolicy,
                                   RuleClauseValidator validator,
                                   ModelCatalog modelCatalog,
                                   FilterEvaluator evaluator,
                                   RunRecorder runRecorder,
                                   UsageTracker usageTracker,
                                   RequestParser requestParser) {
        this.store = store;
        this.accessPolicy = accessPolicy;
        this.validator = validator;
        this.modelCatalog = modelCatalog;
        this.evaluator = evaluator;
        this.runRecorder = runRecorder;
        this.usageTracker = usageTracker;
        this.requestParser = requestParser;
    }

    public Outcome<EvaluateResponse> evaluate(String filterId, CallerContext caller, Map<String, Object> body) {
        long started = System.nanoTime();
        Instant executedAt = Instant.now();

        Outcome<EvaluateCommand> parsed = requestParser.parseEvaluateRequest(body);
        if (!parsed.isSuccess()) {
            return Outcome.failure(parsed.getError());
        }
        EvaluateCommand command = parsed.getValue();

        Outcome<SavedFilter> gate = loadAccessible(filterId, caller);
        if (!gate.isSuccess()) {
            return Outcome.failure(gate.getError());
        }
        SavedFilter filter = gate.getValue();
        List<RuleClause> rules = filter.getRules();

        List<EvaluationError> ruleErrors = validator.validate(rules);
        if (!ruleErrors.isEmpty()) {
            logger.warn("Filter {} has {} invalid rule(s): {}", filterId, ruleErrors.size(), ruleErrors);
            return Outcome.failure(summarize(ruleErrors));
        }

        List<ModelRecord> catalog;
        try {
            catalog = modelCatalog.fetchModels();
        } catch (CatalogUnavailableException e) {
            logger.error("Model catalog unavailable while evaluating filter {}", filterId, e);
            return Outcome.failure(EvaluationError.of(ErrorKind.CATALOG_UNAVAILABLE, "Model catalog unavailable"));
        }

        List<ModelRecord> selected = select(catalog, command);
        List<EvaluationResult> results = evaluator.evaluateAll(rules, selected);
        long durationMs = (System.nanoTime() - started) / 1_000_000L;

        RunMetadata meta = RunMetadata.builder()
                .executedBy(caller.getUserId())
                .executedAt(executedAt)
                .durationMs(durationMs)
                .limitUsed(command.getLimit())
                .modelIdsFilter(command.getModelIds())
                .evaluatedModels(selected.stream().map(CompactModel::of).collect(Collectors.toList()))
                .build();

        FilterRun run;
        try {
            run = store.inTransaction(() -> {
                FilterRun recorded = runRecorder.recordRun(filter, rules, results, meta);
                usageTracker.incrementUsage(filter.getId());
                return recorded;
            });
        } catch (PersistenceException | DataAccessException | TransactionException | MongoException e) {
            logger.error("Evaluation of filter {} completed but could not be recorded", filterId, e);
            return Outcome.failure(EvaluationError.of(ErrorKind.PERSISTENCE,
                    "Evaluation could not be recorded: " + e.getMessage()));
        }

        int matchCount = EvaluationResults.countMatches(results);
        logger.info("Filter {} evaluated by {}: {} models, {} matched, run {} ({} ms)",
                filterId, caller, results.size(), matchCount, run.getId(), durationMs);

        return Outcome.success(EvaluateResponse.builder()
                .filterId(filter.getId())
                .filterName(filter.getName())
                .runId(run.getId())
                .durationMs(durationMs)
                .totalEvaluated(results.size())
                .matchCount(matchCount)
                .results(results)
                .build());
    }

    public Outcome<RunPage> listRuns(String filterId, CallerContext caller, String page, String pageSize) {
        Outcome<Paging> paging = requestParser.parsePaging(page, pageSize);
        if (!paging.isSuccess()) {
            return Outcome.failure(paging.getError());
        }
        Outcome<SavedFilter> gate = loadAccessible(filterId, caller);
        if (!gate.isSuccess()) {
            return Outcome.failure(gate.getError());
        }
        try {
            return Outcome.success(store.findRuns(filterId, paging.getValue().getPage(), paging.getValue().getPageSize()));
        } catch (PersistenceException e) {
            logger.error("Failed to list runs for filter {}", filterId, e);
            return Outcome.failure(EvaluationError.of(ErrorKind.PERSISTENCE, "Failed to list runs"));
        }
    }

    public Outcome<FilterRun> getRun(String filterId, String runId, CallerContext caller) {
        Outcome<SavedFilter> gate = loadAccessible(filterId, caller);
        if (!gate.isSuccess()) {
            return Outcome.failure(gate.getError());
        }
        try {
            return store.findRun(filterId, runId)
                    .map(Outcome::success)
                    .orElseGet(() -> Outcome.failure(EvaluationError.notFound("Filter run")));
        } catch (PersistenceException e) {
            logger.error("Failed to load run {} of filter {}", runId, filterId, e);
            return Outcome.failure(EvaluationError.of(ErrorKind.PERSISTENCE, "Failed to load run"));
        }
    }

    private Outcome<SavedFilter> loadAccessible(String filterId, CallerContext caller) {
        Optional<SavedFilter> found;
        try {
            found = store.findFilter(filterId);
        } catch (PersistenceException e) {
            logger.error("Failed to load filter {}", filterId, e);
            return Outcome.failure(EvaluationError.of(ErrorKind.PERSISTENCE, "Failed to load filter"));
        }
        if (found.isEmpty()) {
            return Outcome.failure(EvaluationError.notFound("Filter"));
        }
        if (!accessPolicy.canAccess(caller, found.get())) {
            logger.info("Access to filter {} denied for {}", filterId, caller);
            return Outcome.failure(EvaluationError.of(ErrorKind.ACCESS_DENIED, "You do not have access to this filter"));
        }
        return Outcome.success(found.get());
    }

    static List<ModelRecord> select(List<ModelRecord> catalog, EvaluateCommand command) {
        List<ModelRecord> candidates = catalog;
        if (command.getModelIds() != null) {
            Set<String> wanted = new HashSet<>(command.getModelIds());
            candidates = catalog.stream()
                    .filter(m -> m.getId() != null && wanted.contains(m.getId()))
                    .collect(Collectors.toList());
        }
        return candidates.size() > command.getLimit()
                ? new ArrayList<>(candidates.subList(0, command.getLimit()))
                : new ArrayList<>(candidates);
    }

    private static EvaluationError summarize(List<EvaluationError> errors) {
        EvaluationError first = errors.get(0);
        if (errors.size() == 1) {
            return first;
        }
        return EvaluationError.validation(first.getField(),
                first.getMessage() + " (and " + (errors.size() - 1) + " more)");
    }
}
