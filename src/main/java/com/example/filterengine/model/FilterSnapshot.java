package com.example.filterengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Frozen copy of a filter definition taken when a run executes.
 */
@Value
@Builder
@AllArgsConstructor
public class FilterSnapshot {
    String id;
    String name;
    String description;
    String visibility;
    List<RuleClause> rules;
    int version;

    /**
     * Copies identity from the filter and the rules that were actually evaluated.
     * Clause values are deep-copied so later edits to the live filter cannot leak in.
     */
    public static FilterSnapshot capture(SavedFilter filter, List<RuleClause> rules) {
        List<RuleClause> copied = rules == null ? List.of() : rules.stream()
                .map(RuleClause::deepCopy)
                .collect(Collectors.toList());
        return FilterSnapshot.builder()
                .id(filter.getId())
                .name(filter.getName())
                .description(filter.getDescription())
                .visibility(filter.getVisibility())
                .rules(Collections.unmodifiableList(copied))
                .version(filter.getVersion())
                .build();
    }
}
