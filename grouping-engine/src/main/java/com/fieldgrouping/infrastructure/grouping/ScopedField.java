package com.fieldgrouping.infrastructure.grouping;

import com.fieldgrouping.domain.grouping.model.Field;

/**
 * A field tagged with its position in the scope's input list.
 * Positions keep duplicated fields apart while the pipeline claims them.
 */
public record ScopedField(int position, Field field) {

    public String name() {
        return field.name();
    }
}
