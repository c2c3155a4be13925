package com.fieldgrouping.domain.grouping.model;

/**
 * UI control family for a closed value domain.
 */
public enum RenderType {
    DEFAULT,
    DROPDOWN,
    RADIO_BUTTONS,
    CHECKBOX,
    YES_NO_BUTTONS,
    ICON_PALETTE
}
