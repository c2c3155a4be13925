package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * Category structure implied by a whole section's labels, outer to inner.
 */
public record ImpliedCategoryCombination(
        List<ImpliedCategory> categories,
        double confidence,
        CategoryPattern pattern,
        int totalFields,
        int structuredFields
) {

    public ImpliedCategoryCombination {
        categories = List.copyOf(categories);
    }
}
