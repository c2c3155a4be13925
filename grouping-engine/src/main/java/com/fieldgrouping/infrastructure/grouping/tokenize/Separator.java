package com.fieldgrouping.infrastructure.grouping.tokenize;

import com.fieldgrouping.domain.grouping.model.CategoryPattern;

/**
 * Candidate label separators in priority order (earlier wins ties).
 * PARENTHETICAL covers {@code "Base (A B C)"} labels and always comes last.
 */
public enum Separator {
    HYPHEN(" - ", " - ", CategoryPattern.HIERARCHICAL),
    PIPE("|", " | ", CategoryPattern.PIPE_DELIM),
    UNDERSCORE("_", " ", CategoryPattern.UNDERSCORE_DELIM),
    COLON(":", ": ", CategoryPattern.PREFIX_GROUPED),
    PARENTHETICAL("()", " ", CategoryPattern.HIERARCHICAL);

    private final String literal;
    private final String joiner;
    private final CategoryPattern pattern;

    Separator(String literal, String joiner, CategoryPattern pattern) {
        this.literal = literal;
        this.joiner = joiner;
        this.pattern = pattern;
    }

    public String literal() {
        return literal;
    }

    /**
     * Text used to glue tokens back into a display title.
     */
    public String joiner() {
        return joiner;
    }

    public CategoryPattern pattern() {
        return pattern;
    }
}
