package com.example.filterengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Verdict for one model against one filter. {@code match} always equals
 * {@code matchedAllHard}: soft score never overrides a hard failure.
 */
@Value
@Builder
@AllArgsConstructor
public class EvaluationResult {
    String modelId;
    String modelName;
    boolean match;
    boolean matchedAllHard;
    double score;
    int failedHardCount;
    int passedSoftCount;
    int totalSoftCount;
    String rationale;
    List<ClauseResult> clauseResults;
}
