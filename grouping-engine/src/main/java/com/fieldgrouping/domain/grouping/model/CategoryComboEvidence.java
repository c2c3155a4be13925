package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * Server-declared category combo structure. Only evidence allowed for {@link ConfidenceLevel#HIGH}.
 */
public record CategoryComboEvidence(
        String categoryComboUid,
        List<CategoryStructure> categoryComboStructure,
        InferredCategoryCombo inferredCategoryCombo,
        String detectionMethod,
        List<String> notes
) implements GroupMetadata {

    public CategoryComboEvidence {
        if (categoryComboUid == null || categoryComboUid.isBlank()) {
            throw new IllegalArgumentException("categoryComboUid is required");
        }
        if (categoryComboStructure == null || categoryComboStructure.isEmpty()) {
            throw new IllegalArgumentException("categoryComboStructure must not be empty");
        }
        categoryComboStructure = List.copyOf(categoryComboStructure);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    @Override
    public EvidenceKind kind() {
        return EvidenceKind.CATEGORY_COMBO;
    }

    @Override
    public CategoryComboEvidence withNotes(List<String> notes) {
        return new CategoryComboEvidence(categoryComboUid, categoryComboStructure, inferredCategoryCombo,
                detectionMethod, notes);
    }
}
