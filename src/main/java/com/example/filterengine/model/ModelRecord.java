package com.example.filterengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Flat attribute bag for one catalog model. Lookups are untyped; a field that is
 * absent (or explicitly null) resolves to an empty Optional.
 */
public final class ModelRecord {

    private final Map<String, Object> attributes;

    private ModelRecord(Map<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @JsonCreator
    public static ModelRecord of(Map<String, Object> attributes) {
        return new ModelRecord(attributes == null ? Map.of() : attributes);
    }

    @JsonValue
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public String getId() {
        Object id = attributes.get("id");
        return id != null ? id.toString() : null;
    }

    public String getName() {
        Object name = attributes.get("name");
        return name != null ? name.toString() : getId();
    }

    /**
     * Resolves a field name or a dot path ({@code cost.input}) through nested maps.
     */
    public Optional<Object> lookup(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        if (attributes.containsKey(path)) {
            return Optional.ofNullable(attributes.get(path));
        }
        Object current = attributes;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return Optional.empty();
            }
            Map<?, ?> map = (Map<?, ?>) current;
            if (!map.containsKey(part)) {
                return Optional.empty();
            }
            current = map.get(part);
        }
        return Optional.ofNullable(current);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelRecord)) return false;
        return attributes.equals(((ModelRecord) o).attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    @Override
    public String toString() {
        return "ModelRecord" + attributes;
    }
}
