package com.resurrector.model;

/**
 * Stages an analysis passes through inside the normalizer, in order.
 */
public enum AnalysisStage {
    VALIDATING,
    DISPATCHED,
    UNWRAPPING,
    INFERRING,
    KEY_DETECTING,
    OPERATION_MAPPING,
    NAMING,
    ASSEMBLED
}
