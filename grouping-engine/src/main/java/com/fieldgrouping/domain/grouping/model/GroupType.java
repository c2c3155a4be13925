package com.fieldgrouping.domain.grouping.model;

public enum GroupType {
    RADIO_GROUP,
    CHECKBOX_GROUP,
    DIMENSIONAL_GRID,
    SEMANTIC_CLUSTER,
    FLAT_LIST
}
