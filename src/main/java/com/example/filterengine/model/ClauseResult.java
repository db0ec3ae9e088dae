package com.example.filterengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class ClauseResult {
    String field;
    String operator;
    String kind;
    boolean matched;
    String reason;
}
