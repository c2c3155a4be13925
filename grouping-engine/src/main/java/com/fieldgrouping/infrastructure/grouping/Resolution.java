package com.fieldgrouping.infrastructure.grouping;

import com.fieldgrouping.domain.grouping.model.GroupMetadata;
import com.fieldgrouping.domain.grouping.model.GroupType;

import java.util.List;

/**
 * A group claimed by one pipeline stage, before it becomes a GroupingStrategy.
 */
public record Resolution(List<ScopedField> members, GroupType groupType, String title, GroupMetadata metadata) {

    public Resolution {
        members = List.copyOf(members);
    }
}
