package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * @param baseName   label text shared by every member, e.g. "Pupils Fed"
 * @param dimensions axes ordered by token position
 */
public record DimensionalPattern(String baseName, List<Dimension> dimensions) {

    public DimensionalPattern {
        dimensions = List.copyOf(dimensions);
    }
}
