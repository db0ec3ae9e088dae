package com.example.filterengine.error;

import java.util.Map;
import java.util.Objects;

/**
 * Expected failure of a filter operation, returned to the caller rather than thrown.
 */
public final class EvaluationError {
    private final ErrorKind kind;
    private final String message;
    private final String field;

    private EvaluationError(ErrorKind kind, String message, String field) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
        this.field = field;
    }

    public static EvaluationError of(ErrorKind kind, String message) {
        return new EvaluationError(kind, message, null);
    }

    public static EvaluationError validation(String field, String message) {
        return new EvaluationError(ErrorKind.VALIDATION, message, field);
    }

    public static EvaluationError notFound(String what) {
        return new EvaluationError(ErrorKind.NOT_FOUND, what + " not found", null);
    }

    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public String getField() { return field; }

    public Map<String, Object> toMap() {
        if (field == null) {
            return Map.of("error", message, "code", kind.name());
        }
        return Map.of("error", message, "code", kind.name(), "field", field);
    }

    @Override
    public String toString() {
        return kind + (field != null ? "[" + field + "]" : "") + ": " + message;
    }
}
