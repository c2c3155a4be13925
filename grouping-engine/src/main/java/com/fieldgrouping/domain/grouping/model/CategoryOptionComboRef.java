package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * A server category option combo: one concrete cell of a category combo.
 */
public record CategoryOptionComboRef(String comboId, List<String> optionIds) {

    public CategoryOptionComboRef {
        optionIds = List.copyOf(optionIds);
    }
}
