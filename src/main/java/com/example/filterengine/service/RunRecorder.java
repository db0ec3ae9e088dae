package com.example.filterengine.service;

import com.example.filterengine.artifact.ArtifactStore;
import com.example.filterengine.error.PersistenceException;
import com.example.filterengine.evaluation.EvaluationResults;
import com.example.filterengine.model.*;
import com.example.filterengine.store.FilterStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes the immutable history record of one evaluation: a frozen snapshot of
 * the filter, the per-model results and the summary counters.
 */
@Service
public class RunRecorder {

    private static final Logger logger = LoggerFactory.getLogger(RunRecorder.class);

    static final String FULL_RESULTS = "fullResults";
    static final String MODEL_LIST = "modelList";

    private final FilterStore store;
    private final ArtifactStore artifactStore;
    private final ObjectMapper objectMapper;

    @Value("${app.runs.offload-threshold:1000}")
    private int offloadThreshold = 1000;

    @Value("${app.runs.store-model-list:true}")
    private boolean storeModelList = true;

    public RunRecorder(FilterStore store, ArtifactStore artifactStore, ObjectMapper objectMapper) {
        this.store = store;
        this.artifactStore = artifactStore;
        this.objectMapper = objectMapper;
    }

    /**
     * Builds and inserts the run. Payloads larger than the offload threshold go to
     * the artifact store and only their first entries stay inline.
     *
     * @throws PersistenceException if the artifact or run write fails
     */
    public FilterRun recordRun(SavedFilter filter, List<RuleClause> rules,
                               List<EvaluationResult> results, RunMetadata meta) {
        String runId = UUID.randomUUID().toString();
        Map<String, String> artifacts = new LinkedHashMap<>();

        try {
            FilterRun run = buildRun(runId, filter, rules, results, meta, artifacts);
            store.insertRun(run);
            logger.debug("Recorded run {} for filter {} ({} evaluated, {} matched, artifacts={})",
                    runId, filter.getId(), run.getTotalEvaluated(), run.getMatchCount(), artifacts.keySet());
            return run;
        } catch (RuntimeException e) {
            discardArtifacts(runId, artifacts);
            throw e;
        }
    }

    private FilterRun buildRun(String runId, SavedFilter filter, List<RuleClause> rules,
                               List<EvaluationResult> results, RunMetadata meta, Map<String, String> artifacts) {
        List<EvaluationResult> inlineResults = results;
        if (results.size() > offloadThreshold) {
            artifacts.put(FULL_RESULTS, artifactStore.store(runId, "results.json", toJson(results)));
            inlineResults = results.subList(0, offloadThreshold);
        }

        List<CompactModel> modelList = null;
        if (storeModelList && meta.getEvaluatedModels() != null) {
            modelList = meta.getEvaluatedModels();
            if (modelList.size() > offloadThreshold) {
                artifacts.put(MODEL_LIST, artifactStore.store(runId, "models.json", toJson(modelList)));
                modelList = modelList.subList(0, offloadThreshold);
            }
        }

        Instant executedAt = meta.getExecutedAt() != null ? meta.getExecutedAt() : Instant.now();
        return FilterRun.builder()
                .id(runId)
                .filterId(filter.getId())
                .executedBy(meta.getExecutedBy())
                .executedAt(executedAt)
                .durationMs(meta.getDurationMs())
                .filterSnapshot(FilterSnapshot.capture(filter, rules))
                .modelList(modelList == null ? null : List.copyOf(modelList))
                .limitUsed(meta.getLimitUsed())
                .modelIdsFilter(meta.getModelIdsFilter() == null ? null : List.copyOf(meta.getModelIdsFilter()))
                .totalEvaluated(results.size())
                .matchCount(EvaluationResults.countMatches(results))
                .results(List.copyOf(inlineResults))
                .artifacts(artifacts.isEmpty() ? null : Map.copyOf(artifacts))
                .createdAt(Instant.now())
                .build();
    }

    /**
     * Best-effort removal of artifacts written for a run that was never stored.
     */
    private void discardArtifacts(String runId, Map<String, String> artifacts) {
        for (String reference : artifacts.values()) {
            try {
                artifactStore.delete(reference);
            } catch (PersistenceException e) {
                logger.warn("Could not delete orphaned artifact {} of run {}: {}", reference, runId, e.getMessage());
            }
        }
    }

    private byte[] toJson(Object payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize run payload", e);
        }
    }
}
