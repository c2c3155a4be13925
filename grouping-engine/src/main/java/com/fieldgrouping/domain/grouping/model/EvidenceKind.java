package com.fieldgrouping.domain.grouping.model;

/**
 * Discriminator of {@link GroupMetadata}. Each kind fixes the confidence tier it may be reported with.
 */
public enum EvidenceKind {
    CATEGORY_COMBO(ConfidenceLevel.HIGH),
    DIMENSIONAL(ConfidenceLevel.MEDIUM),
    EXCLUSIVITY(ConfidenceLevel.MEDIUM),
    SEMANTIC(ConfidenceLevel.LOW);

    private final ConfidenceLevel confidence;

    EvidenceKind(ConfidenceLevel confidence) {
        this.confidence = confidence;
    }

    public ConfidenceLevel confidence() {
        return confidence;
    }
}
