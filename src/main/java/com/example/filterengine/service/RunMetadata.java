package com.example.filterengine.service;

import com.example.filterengine.model.CompactModel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Execution context recorded alongside a run's results.
 */
@Value
@Builder
public class RunMetadata {
    String executedBy;
    Instant executedAt;
    long durationMs;
    Integer limitUsed;
    List<String> modelIdsFilter;
    List<CompactModel> evaluatedModels;
}
