package com.example.filterengine.evaluation;

/**
 * Order of a batch result list. Both are total orders, so repeated
 * evaluations of the same input come back identically ordered.
 */
public enum ResultOrder {
    /** Same order as the candidate list. */
    INPUT,
    /** Ascending model id, candidate position as tie-breaker. */
    MODEL_ID
}
