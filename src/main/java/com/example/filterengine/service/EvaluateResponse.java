package com.example.filterengine.service;

import com.example.filterengine.model.EvaluationResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EvaluateResponse {
    String filterId;
    String filterName;
    String runId;
    long durationMs;
    int totalEvaluated;
    int matchCount;
    List<EvaluationResult> results;
}
