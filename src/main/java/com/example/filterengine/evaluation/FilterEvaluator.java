package com.example.filterengine.evaluation;

import com.example.filterengine.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Composes clause comparisons into a per-model verdict and maps that over a
 * candidate list. Stateless apart from configuration; safe to call concurrently.
 */
@Component
public class FilterEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FilterEvaluator.class);

    private final ClauseComparator comparator;

    @Value("${app.evaluate.parallel-threshold:200}")
    private int parallelThreshold = 200;

    @Value("${app.evaluate.result-order:INPUT}")
    private ResultOrder resultOrder = ResultOrder.INPUT;

    public FilterEvaluator(ClauseComparator comparator) {
        this.comparator = comparator;
    }

    public EvaluationResult evaluate(List<RuleClause> rules, ModelRecord model) {
        return evaluate(PartitionedRules.of(rules), model);
    }

    /**
     * Evaluates every model. Large batches run on a parallel stream; the
     * configured order is then applied as a sort, so scheduling never shows
     * through in the output.
     */
    public List<EvaluationResult> evaluateAll(List<RuleClause> rules, List<ModelRecord> models) {
        PartitionedRules partitioned = PartitionedRules.of(rules);
        boolean parallel = models.size() >= parallelThreshold;
        logger.debug("Evaluating {} clauses against {} models (parallel={})", partitioned.size(), models.size(), parallel);

        IntStream indices = IntStream.range(0, models.size());
        if (parallel) {
            indices = indices.parallel();
        }
        List<Positioned> evaluated = indices
                .mapToObj(i -> new Positioned(i, evaluate(partitioned, models.get(i))))
                .collect(Collectors.toCollection(ArrayList::new));

        evaluated.sort(comparatorFor(resultOrder));
        return evaluated.stream().map(p -> p.result).collect(Collectors.toList());
    }

    private EvaluationResult evaluate(PartitionedRules rules, ModelRecord model) {
        List<ClauseResult> diagnostics = new ArrayList<>(rules.size());

        int failedHard = 0;
        for (RuleClause clause : rules.hard) {
            ComparisonOutcome outcome = comparator.compare(clause, model);
            if (!outcome.isPassed()) {
                failedHard++;
            }
            diagnostics.add(diagnostic(clause, ClauseKind.HARD, outcome));
        }

        int passedSoft = 0;
        double passedWeight = 0.0;
        double totalWeight = 0.0;
        for (RuleClause clause : rules.soft) {
            ComparisonOutcome outcome = comparator.compare(clause, model);
            double weight = clause.effectiveWeight();
            totalWeight += weight;
            if (outcome.isPassed()) {
                passedSoft++;
                passedWeight += weight;
            }
            diagnostics.add(diagnostic(clause, ClauseKind.SOFT, outcome));
        }

        boolean matchedAllHard = failedHard == 0;
        double score = score(matchedAllHard, rules.soft.size(), passedWeight, totalWeight);

        return EvaluationResult.builder()
                .modelId(model.getId())
                .modelName(model.getName())
                .match(matchedAllHard)
                .matchedAllHard(matchedAllHard)
                .score(score)
                .failedHardCount(failedHard)
                .passedSoftCount(passedSoft)
                .totalSoftCount(rules.soft.size())
                .rationale(rationale(rules.hard.size(), failedHard, rules.soft.size(), passedSoft, score))
                .clauseResults(Collections.unmodifiableList(diagnostics))
                .build();
    }

    // Weighted pass fraction of the soft clauses; hard outcome alone when there is no soft weight.
    static double score(boolean matchedAllHard, int softCount, double passedWeight, double totalWeight) {
        if (softCount == 0 || totalWeight <= 0.0) {
            return matchedAllHard ? 1.0 : 0.0;
        }
        double score = passedWeight / totalWeight;
        return Math.max(0.0, Math.min(1.0, score));
    }

    static String rationale(int hardCount, int failedHard, int softCount, int passedSoft, double score) {
        String hardPart;
        if (hardCount == 0) {
            hardPart = "no hard clauses";
        } else if (failedHard == 0) {
            hardPart = String.format(Locale.ROOT, "passed all %d hard clause%s", hardCount, hardCount == 1 ? "" : "s");
        } else {
            hardPart = String.format(Locale.ROOT, "failed %d of %d hard clause%s", failedHard, hardCount, hardCount == 1 ? "" : "s");
        }
        String softPart = softCount == 0
                ? "no soft clauses"
                : String.format(Locale.ROOT, "soft score %.2f (%d of %d soft clauses passed)", score, passedSoft, softCount);
        return hardPart + "; " + softPart;
    }

    private static ClauseResult diagnostic(RuleClause clause, ClauseKind kind, ComparisonOutcome outcome) {
        return ClauseResult.builder()
                .field(clause.getField())
                .operator(clause.getOperator())
                .kind(kind.getWireName())
                .matched(outcome.isPassed())
                .reason(outcome.getReason())
                .build();
    }

    private static Comparator<Positioned> comparatorFor(ResultOrder order) {
        Comparator<Positioned> byPosition = Comparator.comparingInt(p -> p.position);
        if (order == ResultOrder.MODEL_ID) {
            return Comparator.<Positioned, String>comparing(p -> p.result.getModelId(),
                    Comparator.nullsLast(Comparator.naturalOrder())).thenComparing(byPosition);
        }
        return byPosition;
    }

    private static final class Positioned {
        final int position;
        final EvaluationResult result;

        Positioned(int position, EvaluationResult result) {
            this.position = position;
            this.result = result;
        }
    }

    /**
     * Hard and soft clauses split once per batch, each keeping its original relative order.
     * Clauses with an unrecognised type are treated as hard so they can only narrow a match.
     */
    private static final class PartitionedRules {
        final List<RuleClause> hard;
        final List<RuleClause> soft;

        private PartitionedRules(List<RuleClause> hard, List<RuleClause> soft) {
            this.hard = hard;
            this.soft = soft;
        }

        static PartitionedRules of(List<RuleClause> rules) {
            Map<Boolean, List<RuleClause>> split = (rules == null ? List.<RuleClause>of() : rules).stream()
                    .collect(Collectors.partitioningBy(
                            c -> ClauseKind.fromWire(c.getType()).orElse(ClauseKind.HARD) == ClauseKind.SOFT));
            return new PartitionedRules(split.get(false), split.get(true));
        }

        int size() {
            return hard.size() + soft.size();
        }
    }
}
