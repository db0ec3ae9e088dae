package com.example.filterengine.evaluation;

import java.util.Objects;

/**
 * Pass/fail of one clause against one model value, with the reason shown in diagnostics.
 */
public final class ComparisonOutcome {
    private final boolean passed;
    private final String reason;

    private ComparisonOutcome(boolean passed, String reason) {
        this.passed = passed;
        this.reason = reason;
    }

    public static ComparisonOutcome pass(String reason) {
        return new ComparisonOutcome(true, reason);
    }

    public static ComparisonOutcome fail(String reason) {
        return new ComparisonOutcome(false, reason);
    }

    public boolean isPassed() { return passed; }
    public String getReason() { return reason; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonOutcome)) return false;
        ComparisonOutcome that = (ComparisonOutcome) o;
        return passed == that.passed && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(passed, reason);
    }

    @Override
    public String toString() {
        return (passed ? "PASS: " : "FAIL: ") + reason;
    }
}
