package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * Derived analogue of a server category.
 */
public record InferredCategory(
        String name,
        List<String> categoryOptions,
        int optionCount,
        String detectionMethod
) {

    public InferredCategory {
        categoryOptions = List.copyOf(categoryOptions);
    }
}
