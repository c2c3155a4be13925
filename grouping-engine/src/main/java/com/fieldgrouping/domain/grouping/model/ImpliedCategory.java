package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * A category implied by one token level of a section's labels.
 *
 * @param level     token level, 0 = outermost
 * @param separator separator the labels were split with
 */
public record ImpliedCategory(String name, List<String> options, int level, String separator) {

    public ImpliedCategory {
        options = List.copyOf(options);
    }
}
