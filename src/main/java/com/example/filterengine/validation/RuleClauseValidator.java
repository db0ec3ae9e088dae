package com.example.filterengine.validation;

import com.example.filterengine.error.EvaluationError;
import com.example.filterengine.evaluation.ValueSupport;
import com.example.filterengine.model.ClauseKind;
import com.example.filterengine.model.ClauseOperator;
import com.example.filterengine.model.RuleClause;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rejects malformed clauses before they reach the evaluator. Each error names
 * the offending path, e.g. {@code rules[2].operator}.
 */
@Component
public class RuleClauseValidator {

    @Value("${app.rules.enforce-weight-range:true}")
    private boolean enforceWeightRange = true;

    public List<EvaluationError> validate(List<RuleClause> rules) {
        List<EvaluationError> errors = new ArrayList<>();
        if (rules == null) {
            errors.add(EvaluationError.validation("rules", "filter has no rule list"));
            return errors;
        }
        for (int i = 0; i < rules.size(); i++) {
            validateClause(rules.get(i), "rules[" + i + "]", errors);
        }
        return errors;
    }

    private void validateClause(RuleClause clause, String path, List<EvaluationError> errors) {
        if (clause == null) {
            errors.add(EvaluationError.validation(path, "clause is null"));
            return;
        }
        if (clause.getField() == null || clause.getField().isBlank()) {
            errors.add(EvaluationError.validation(path + ".field", "field is required"));
        }

        Optional<ClauseOperator> operator = ClauseOperator.fromWire(clause.getOperator());
        if (operator.isEmpty()) {
            errors.add(EvaluationError.validation(path + ".operator", "unknown operator '" + clause.getOperator() + "'"));
        }
        if (clause.getValue() == null) {
            errors.add(EvaluationError.validation(path + ".value", "value is required"));
        } else if (operator.isPresent() && operator.get() == ClauseOperator.IN
                && ValueSupport.kindOf(clause.getValue()) != ValueSupport.ValueKind.LIST) {
            errors.add(EvaluationError.validation(path + ".value", "'in' requires an array value"));
        }

        Optional<ClauseKind> kind = ClauseKind.fromWire(clause.getType());
        if (kind.isEmpty()) {
            errors.add(EvaluationError.validation(path + ".type", "type must be 'hard' or 'soft', got '" + clause.getType() + "'"));
            return;
        }

        Double weight = clause.getWeight();
        if (kind.get() == ClauseKind.HARD) {
            if (weight != null) {
                errors.add(EvaluationError.validation(path + ".weight", "hard clauses do not take a weight"));
            }
            return;
        }
        // soft: a missing weight means the default of 1.0
        if (weight != null) {
            if (weight.isNaN() || weight.isInfinite()) {
                errors.add(EvaluationError.validation(path + ".weight", "weight must be a finite number"));
            } else if (enforceWeightRange && (weight < 0.0 || weight > 1.0)) {
                errors.add(EvaluationError.validation(path + ".weight", "weight must be within [0, 1], got " + weight));
            }
        }
    }
}
