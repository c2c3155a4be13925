package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * Evidence behind a grouping decision. Exactly one variant exists per evidence kind, so the
 * populated evidence always matches the confidence tier of the owning {@link GroupingStrategy}.
 * <p>
 * The accessors of evidence a variant does not carry return {@code null}.
 * {@link #notes()} carries observability remarks such as a failed metadata fetch.
 */
public sealed interface GroupMetadata
        permits CategoryComboEvidence, DimensionalEvidence, ExclusivityEvidence, SemanticEvidence {

    EvidenceKind kind();

    String detectionMethod();

    List<String> notes();

    GroupMetadata withNotes(List<String> notes);

    default String categoryComboUid() {
        return null;
    }

    default List<CategoryStructure> categoryComboStructure() {
        return null;
    }

    default DimensionalPattern dimensionalPattern() {
        return null;
    }

    default InferredCategoryCombo inferredCategoryCombo() {
        return null;
    }

    default Double mutualExclusivityScore() {
        return null;
    }

    default Double semanticSimilarityScore() {
        return null;
    }

    default Double numericConfidenceScore() {
        return null;
    }
}
