package com.example.filterengine.model;

import com.example.filterengine.evaluation.ValueSupport;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * One filter condition as stored on a saved filter. Operator and type are kept
 * in their wire form so that a malformed stored clause can be reported instead
 * of failing the document mapping.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleClause {

    public static final double DEFAULT_SOFT_WEIGHT = 1.0;

    private String field;
    private String operator; // eq, ne, gt, gte, lt, lte, in, contains
    private Object value;
    private String type;     // hard | soft
    private Double weight;   // soft only

    public double effectiveWeight() {
        return weight != null ? weight : DEFAULT_SOFT_WEIGHT;
    }

    public RuleClause deepCopy() {
        return new RuleClause(field, operator, ValueSupport.deepCopy(value), type, weight);
    }
}
