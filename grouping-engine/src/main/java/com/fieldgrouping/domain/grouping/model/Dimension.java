package com.fieldgrouping.domain.grouping.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One orthogonal axis of a dimensional pattern.
 *
 * @param name   inferred axis name, e.g. "Gender"
 * @param values distinct values in first-seen order
 * @param order  token position of the axis inside the label
 */
public record Dimension(String name, Set<String> values, int order) {

    public Dimension {
        values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
