package com.fieldgrouping.domain.grouping.model;

/**
 * Trust tier of a grouping decision. Declaration order is the trust order, HIGH first.
 */
public enum ConfidenceLevel {
    // server metadata
    HIGH,
    // naming pattern or exclusivity inference
    MEDIUM,
    // similarity guess
    LOW
}
