package com.example.filterengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One evaluation event. Append-only: created once through an insert and never updated.
 */
@Getter
@ToString
@AllArgsConstructor
@Builder
@Document("filter_runs")
@CompoundIndex(name = "filter_executed_idx", def = "{'filterId': 1, 'executedAt': -1}")
public class FilterRun {
    @Id
    private final String id;
    private final String filterId;

    // Execution metadata
    private final String executedBy;
    private final Instant executedAt;
    private final Long durationMs;

    private final FilterSnapshot filterSnapshot;

    // Input parameters
    private final List<CompactModel> modelList;
    private final Integer limitUsed;
    private final List<String> modelIdsFilter;

    // Results
    private final int totalEvaluated;
    private final int matchCount;
    private final List<EvaluationResult> results;

    // External references, e.g. fullResults -> gridfs://...
    private final Map<String, String> artifacts;

    private final Instant createdAt;
}
