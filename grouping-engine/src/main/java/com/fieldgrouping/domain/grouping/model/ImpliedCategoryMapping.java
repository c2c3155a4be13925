package com.fieldgrouping.domain.grouping.model;

import java.util.Map;

/**
 * A field's implied category option per level, plus the trailing field name.
 */
public record ImpliedCategoryMapping(
        String fieldId,
        String fieldLabel,
        Map<Integer, String> categoryOptionsByLevel,
        String fieldName
) {

    public ImpliedCategoryMapping {
        categoryOptionsByLevel = Map.copyOf(categoryOptionsByLevel);
    }
}
