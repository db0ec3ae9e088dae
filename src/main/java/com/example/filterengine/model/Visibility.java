package com.example.filterengine.model;

public enum Visibility {
    PRIVATE("private"),
    TEAM("team"),
    PUBLIC("public");

    private final String wireName;

    Visibility(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Unknown or missing visibility is treated as private.
     */
    public static Visibility fromWire(String value) {
        for (Visibility v : values()) {
            if (v.wireName.equals(value)) {
                return v;
            }
        }
        return PRIVATE;
    }
}
