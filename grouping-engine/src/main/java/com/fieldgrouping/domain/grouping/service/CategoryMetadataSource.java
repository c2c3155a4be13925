package com.fieldgrouping.domain.grouping.service;

import com.fieldgrouping.domain.grouping.model.CategoryOptionComboRef;
import com.fieldgrouping.domain.grouping.model.CategoryStructure;

import java.util.List;

/**
 * Read-only access to server category metadata, supplied by the data-entry repository.
 * <p>
 * Implementations may block, cache, or throw; the engine treats any failure as
 * "no explicit metadata" and never lets it reach its own caller.
 */
public interface CategoryMetadataSource {

    /**
     * Categories of a category combo with their options, in server order.
     */
    List<CategoryStructure> getCategoryComboStructure(String categoryComboId);

    /**
     * Concrete option combos of a category combo.
     */
    List<CategoryOptionComboRef> getCategoryOptionCombos(String categoryComboId);

    static CategoryMetadataSource none() {
        return new CategoryMetadataSource() {
            @Override
            public List<CategoryStructure> getCategoryComboStructure(String categoryComboId) {
                return List.of();
            }

            @Override
            public List<CategoryOptionComboRef> getCategoryOptionCombos(String categoryComboId) {
                return List.of();
            }
        };
    }
}
