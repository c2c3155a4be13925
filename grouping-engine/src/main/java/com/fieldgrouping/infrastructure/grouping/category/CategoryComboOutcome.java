package com.fieldgrouping.infrastructure.grouping.category;

import com.fieldgrouping.infrastructure.grouping.Resolution;

import java.util.List;
import java.util.Map;

/**
 * Groups built from server metadata, plus failure notes keyed by field position for fields whose
 * metadata could not be read.
 */
public record CategoryComboOutcome(List<Resolution> resolutions, Map<Integer, List<String>> failureNotes) {

    public CategoryComboOutcome {
        resolutions = List.copyOf(resolutions);
        failureNotes = Map.copyOf(failureNotes);
    }
}
