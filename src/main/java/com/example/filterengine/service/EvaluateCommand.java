package com.example.filterengine.service;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * A validated evaluate request: optional model allow-list and the clamped limit.
 */
@Value
@AllArgsConstructor
public class EvaluateCommand {
    List<String> modelIds; // null when the caller did not restrict the scope
    int limit;
}
