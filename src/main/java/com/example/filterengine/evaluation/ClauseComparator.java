package com.example.filterengine.evaluation;

import com.example.filterengine.model.ClauseOperator;
import com.example.filterengine.model.ModelRecord;
import com.example.filterengine.model.RuleClause;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

import static com.example.filterengine.evaluation.ValueSupport.*;

/**
 * Decides one clause against one model attribute. Pure: never throws on data,
 * every type mismatch fails closed with an explanation.
 */
@Component
public class ClauseComparator {

    public ComparisonOutcome compare(RuleClause clause, ModelRecord model) {
        return compare(clause, model.lookup(clause.getField()));
    }

    public ComparisonOutcome compare(RuleClause clause, Optional<Object> modelValue) {
        String field = clause.getField();
        Optional<ClauseOperator> operator = ClauseOperator.fromWire(clause.getOperator());
        if (operator.isEmpty()) {
            return ComparisonOutcome.fail("unknown operator '" + clause.getOperator() + "' on " + field);
        }
        if (modelValue.isEmpty()) {
            return ComparisonOutcome.fail(field + " is missing on model");
        }

        Object actual = modelValue.get();
        Object expected = clause.getValue();
        String condition = field + " " + operator.get().getWireName() + " " + render(expected);

        switch (operator.get()) {
            case EQ:
            case NE:
                return equality(condition, operator.get() == ClauseOperator.EQ, actual, expected);
            case GT:
            case GTE:
            case LT:
            case LTE:
                return numeric(condition, operator.get(), actual, expected);
            case IN:
                return membership(condition, actual, expected);
            case CONTAINS:
                return containment(condition, actual, expected);
            default:
                return ComparisonOutcome.fail(condition + " failed: unsupported operator");
        }
    }

    private ComparisonOutcome equality(String condition, boolean wantEqual, Object actual, Object expected) {
        if (isNaN(actual) || isNaN(expected)) {
            return nonNumeric(condition, actual, expected);
        }
        if (kindOf(actual) != kindOf(expected)) {
            return mismatch(condition, actual, expected);
        }
        boolean equal = deepEquals(actual, expected);
        return verdict(condition, equal == wantEqual, actual);
    }

    private ComparisonOutcome numeric(String condition, ClauseOperator op, Object actual, Object expected) {
        if (!(actual instanceof Number) || !(expected instanceof Number) || isNaN(actual) || isNaN(expected)) {
            return nonNumeric(condition, actual, expected);
        }
        int cmp = compareNumbers((Number) actual, (Number) expected);
        boolean passed;
        switch (op) {
            case GT:
                passed = cmp > 0;
                break;
            case GTE:
                passed = cmp >= 0;
                break;
            case LT:
                passed = cmp < 0;
                break;
            default:
                passed = cmp <= 0;
        }
        return verdict(condition, passed, actual);
    }

    private ComparisonOutcome membership(String condition, Object actual, Object expected) {
        if (kindOf(expected) != ValueKind.LIST) {
            return ComparisonOutcome.fail(condition + " failed: 'in' needs an array clause value, got "
                    + describeKind(expected));
        }
        if (!isScalar(actual)) {
            return ComparisonOutcome.fail(condition + " failed: 'in' needs a scalar model value, got "
                    + describeKind(actual));
        }
        return verdict(condition, containsDeep(asList(expected), actual), actual);
    }

    private ComparisonOutcome containment(String condition, Object actual, Object expected) {
        if (kindOf(actual) != ValueKind.LIST) {
            return ComparisonOutcome.fail(condition + " failed: 'contains' needs an array model value, got "
                    + describeKind(actual));
        }
        List<?> items = asList(actual);
        return verdict(condition, containsDeep(items, expected), actual);
    }

    private ComparisonOutcome nonNumeric(String condition, Object actual, Object expected) {
        return ComparisonOutcome.fail(condition + " failed: non-numeric operand (model value "
                + render(actual) + " is " + describeKind(actual) + ", clause value is "
                + describeKind(expected) + ")");
    }

    private ComparisonOutcome mismatch(String condition, Object actual, Object expected) {
        return ComparisonOutcome.fail(condition + " failed: type mismatch (model value " + render(actual)
                + " is " + describeKind(actual) + ", clause value is " + describeKind(expected) + ")");
    }

    private ComparisonOutcome verdict(String condition, boolean passed, Object actual) {
        String reason = condition + (passed ? " passed" : " failed") + " (actual " + render(actual) + ")";
        return passed ? ComparisonOutcome.pass(reason) : ComparisonOutcome.fail(reason);
    }
}
