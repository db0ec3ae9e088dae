package com.example.filterengine.error;

import java.util.NoSuchElementException;

/**
 * Either a value or an {@link EvaluationError}.
 */
public final class Outcome<T> {
    private final T value;
    private final EvaluationError error;

    private Outcome(T value, EvaluationError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(EvaluationError error) {
        return new Outcome<>(null, error);
    }

    public boolean isSuccess() { return error == null; }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("Outcome is a failure: " + error);
        }
        return value;
    }

    public EvaluationError getError() {
        if (error == null) {
            throw new NoSuchElementException("Outcome is a success");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
