package com.fieldgrouping.domain.grouping.model;

import java.util.List;

public record DimensionalEvidence(
        DimensionalPattern dimensionalPattern,
        InferredCategoryCombo inferredCategoryCombo,
        String detectionMethod,
        List<String> notes
) implements GroupMetadata {

    public DimensionalEvidence {
        if (dimensionalPattern == null) {
            throw new IllegalArgumentException("dimensionalPattern is required");
        }
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    @Override
    public EvidenceKind kind() {
        return EvidenceKind.DIMENSIONAL;
    }

    @Override
    public DimensionalEvidence withNotes(List<String> notes) {
        return new DimensionalEvidence(dimensionalPattern, inferredCategoryCombo, detectionMethod, notes);
    }
}
