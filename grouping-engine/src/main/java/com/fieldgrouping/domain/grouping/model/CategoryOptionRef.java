package com.fieldgrouping.domain.grouping.model;

/**
 * A server category option as returned by the metadata collaborator.
 *
 * @param icon optional icon identifier, nullable
 */
public record CategoryOptionRef(String id, String displayName, String icon) {

    public CategoryOptionRef(String id, String displayName) {
        this(id, displayName, null);
    }
}
