package com.fieldgrouping.domain.grouping.model;

/**
 * One entry of an {@link OptionSet}.
 *
 * @param code        stored value
 * @param name        display name
 * @param displayName alternative display name, nullable
 * @param icon        icon identifier for visual rendering, nullable
 * @param color       hex color for visual rendering, nullable
 * @param sortOrder   position in which the option should appear
 */
public record Option(String code, String name, String displayName, String icon, String color, int sortOrder) {

    public static Option of(String code, String name) {
        return new Option(code, name, null, null, null, 0);
    }

    public static Option of(String code, String name, int sortOrder) {
        return new Option(code, name, null, null, null, sortOrder);
    }

    public String label() {
        return displayName != null ? displayName : name;
    }
}
