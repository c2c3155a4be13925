package com.fieldgrouping.infrastructure.grouping.pipeline;

/**
 * Stages of one scope's grouping run, in the order they claim fields.
 */
public enum GroupingStage {
    TRY_CATEGORY_COMBO,
    TRY_DIMENSIONAL,
    TRY_EXCLUSIVITY,
    TRY_SEMANTIC,
    EMIT_FLAT_REMAINDER
}
