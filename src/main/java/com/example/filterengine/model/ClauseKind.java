package com.example.filterengine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Hard clauses gate the match, soft clauses only contribute weighted score.
 */
public enum ClauseKind {
    HARD("hard"),
    SOFT("soft");

    private final String wireName;

    ClauseKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ClauseKind> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(value))
                .findFirst();
    }
}
