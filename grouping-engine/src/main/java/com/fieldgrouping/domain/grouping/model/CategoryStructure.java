package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * One server category of a category combo with its options, in server order.
 */
public record CategoryStructure(String categoryName, List<CategoryOptionRef> options) {

    public CategoryStructure {
        options = List.copyOf(options);
    }
}
