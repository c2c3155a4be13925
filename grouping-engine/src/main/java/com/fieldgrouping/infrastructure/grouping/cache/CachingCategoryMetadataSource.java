package com.fieldgrouping.infrastructure.grouping.cache;

import com.fieldgrouping.domain.grouping.model.CategoryOptionComboRef;
import com.fieldgrouping.domain.grouping.model.CategoryStructure;
import com.fieldgrouping.domain.grouping.service.CategoryMetadataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Serves category metadata from a caller-owned cache, falling back to the delegate on a miss.
 * Only successful answers are stored; a failing delegate is asked again next time.
 */
@Slf4j
@RequiredArgsConstructor
public class CachingCategoryMetadataSource implements CategoryMetadataSource {

    private final CategoryMetadataSource delegate;
    private final CategoryMetadataCache cache;

    @Override
    public List<CategoryStructure> getCategoryComboStructure(String categoryComboId) {
        Optional<List<CategoryStructure>> cached = cache.getStructure(categoryComboId);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<CategoryStructure> structure = delegate.getCategoryComboStructure(categoryComboId);
        List<CategoryStructure> result = structure != null ? structure : List.of();
        cache.putStructure(categoryComboId, result);
        log.debug("[MetadataCache] cached structure of {} ({} categories)", categoryComboId, result.size());
        return result;
    }

    @Override
    public List<CategoryOptionComboRef> getCategoryOptionCombos(String categoryComboId) {
        Optional<List<CategoryOptionComboRef>> cached = cache.getOptionCombos(categoryComboId);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<CategoryOptionComboRef> combos = delegate.getCategoryOptionCombos(categoryComboId);
        List<CategoryOptionComboRef> result = combos != null ? combos : List.of();
        cache.putOptionCombos(categoryComboId, result);
        return result;
    }
}
