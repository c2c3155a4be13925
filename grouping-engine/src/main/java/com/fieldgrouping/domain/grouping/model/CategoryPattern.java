package com.fieldgrouping.domain.grouping.model;

/**
 * Naming pattern family of a set of labels.
 */
public enum CategoryPattern {
    // "Category1 - Category2 - Field"
    HIERARCHICAL,
    // "Prefix: Field"
    PREFIX_GROUPED,
    // "Category1_Category2_Field"
    UNDERSCORE_DELIM,
    // "Category1 | Category2 | Field"
    PIPE_DELIM,
    FLAT
}
