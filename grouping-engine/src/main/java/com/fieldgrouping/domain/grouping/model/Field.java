package com.fieldgrouping.domain.grouping.model;

/**
 * One data-capture field of a form section. Owned by the caller; the engine never changes it.
 *
 * @param id                      data element id (shared by the category-option-combo rows of one element)
 * @param name                    display label the naming heuristics work on
 * @param sectionName             section (rendering scope) the field belongs to
 * @param categoryOptionCombo     category option combo id of this row
 * @param dataEntryType           declared value type
 * @param explicitCategoryComboId server category combo id, nullable when the server declared none
 * @param optionSet               closed value domain, nullable
 */
public record Field(
        String id,
        String name,
        String sectionName,
        String categoryOptionCombo,
        DataEntryType dataEntryType,
        String explicitCategoryComboId,
        OptionSet optionSet
) {

    public Field {
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        if (name == null) {
            name = "";
        }
        if (sectionName == null) {
            sectionName = "";
        }
        if (dataEntryType == null) {
            dataEntryType = DataEntryType.TEXT;
        }
    }

    public Field(String id, String name, String sectionName, String categoryOptionCombo,
                 DataEntryType dataEntryType, String explicitCategoryComboId) {
        this(id, name, sectionName, categoryOptionCombo, dataEntryType, explicitCategoryComboId, null);
    }

    public static Field of(String id, String name, DataEntryType dataEntryType) {
        return new Field(id, name, "", null, dataEntryType, null, null);
    }

    public boolean hasExplicitCategoryCombo() {
        return explicitCategoryComboId != null && !explicitCategoryComboId.isBlank();
    }
}
