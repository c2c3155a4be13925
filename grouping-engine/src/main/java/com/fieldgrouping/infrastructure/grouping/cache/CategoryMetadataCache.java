package com.fieldgrouping.infrastructure.grouping.cache;

import com.fieldgrouping.domain.grouping.model.CategoryOptionComboRef;
import com.fieldgrouping.domain.grouping.model.CategoryStructure;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Category metadata keyed by category combo id. Owned by the caller, e.g. one instance per sync session;
 * invalidate after metadata changes on the server.
 */
public class CategoryMetadataCache {

    private final Map<String, List<CategoryStructure>> structures = new ConcurrentHashMap<>();
    private final Map<String, List<CategoryOptionComboRef>> optionCombos = new ConcurrentHashMap<>();

    public Optional<List<CategoryStructure>> getStructure(String categoryComboId) {
        return Optional.ofNullable(structures.get(categoryComboId));
    }

    public void putStructure(String categoryComboId, List<CategoryStructure> structure) {
        structures.put(categoryComboId, List.copyOf(structure));
    }

    public Optional<List<CategoryOptionComboRef>> getOptionCombos(String categoryComboId) {
        return Optional.ofNullable(optionCombos.get(categoryComboId));
    }

    public void putOptionCombos(String categoryComboId, List<CategoryOptionComboRef> combos) {
        optionCombos.put(categoryComboId, List.copyOf(combos));
    }

    public void invalidate(String categoryComboId) {
        structures.remove(categoryComboId);
        optionCombos.remove(categoryComboId);
    }

    public void invalidateAll() {
        structures.clear();
        optionCombos.clear();
    }

    public int size() {
        return structures.size() + optionCombos.size();
    }
}
