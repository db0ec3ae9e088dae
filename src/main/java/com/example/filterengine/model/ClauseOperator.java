package com.example.filterengine.model;

import java.util.Arrays;
import java.util.Optional;

public enum ClauseOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    IN("in"),
    CONTAINS("contains");

    private final String wireName;

    ClauseOperator(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ClauseOperator> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(value))
                .findFirst();
    }
}
