package com.fieldgrouping.infrastructure.grouping.exclusivity;

import com.fieldgrouping.infrastructure.grouping.ScopedField;

import java.util.List;

/**
 * A cluster of fields sharing a subject, e.g. "School Type" for "School Type - Public".
 *
 * @param options member labels with the subject removed, in member order
 * @param pass    candidate pass that produced the cluster
 */
public record ExclusivityCandidate(String subject, List<ScopedField> members, List<String> options, String pass) {

    public ExclusivityCandidate {
        members = List.copyOf(members);
        options = List.copyOf(options);
    }
}
