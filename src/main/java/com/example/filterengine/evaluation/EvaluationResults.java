package com.example.filterengine.evaluation;

import com.example.filterengine.model.EvaluationResult;

import java.util.List;
import java.util.Locale;

public final class EvaluationResults {

    private EvaluationResults() {}

    public static int countMatches(List<EvaluationResult> results) {
        return (int) results.stream().filter(EvaluationResult::isMatch).count();
    }

    /**
     * One-line summary for logs and tool output.
     */
    public static String describe(EvaluationResult result) {
        if (!result.isMatch()) {
            int failed = result.getFailedHardCount();
            return String.format(Locale.ROOT, "rejected (%d hard clause%s failed)", failed, failed == 1 ? "" : "s");
        }
        if (result.getTotalSoftCount() == 0) {
            return "passed (hard clauses only)";
        }
        return String.format(Locale.ROOT, "passed with score %.1f%% (%d/%d soft clauses)",
                result.getScore() * 100, result.getPassedSoftCount(), result.getTotalSoftCount());
    }
}
