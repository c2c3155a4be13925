package com.fieldgrouping.domain.grouping.model;

/**
 * Outcome of separator detection over a label set.
 *
 * @param separator  accepted separator literal, {@code null} when the pattern is {@link CategoryPattern#FLAT}
 * @param pattern    pattern family of the separator
 * @param confidence consistency ratio of the accepted separator, 0 when flat
 */
public record SeparatorDetection(String separator, CategoryPattern pattern, double confidence) {

    public static SeparatorDetection flat() {
        return new SeparatorDetection(null, CategoryPattern.FLAT, 0.0);
    }

    public boolean isFlat() {
        return pattern == CategoryPattern.FLAT;
    }
}
