package com.fieldgrouping.infrastructure.grouping.render;

import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.GroupingStrategy;
import com.fieldgrouping.domain.grouping.model.Option;
import com.fieldgrouping.domain.grouping.model.OptionSet;
import com.fieldgrouping.domain.grouping.model.RenderType;
import com.fieldgrouping.infrastructure.grouping.exclusivity.ExclusivityCandidateFinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps an option set to a UI control family:
 * <ul>
 *   <li>exactly 2 boolean-like codes → YES_NO_BUTTONS</li>
 *   <li>up to 4 options → RADIO_BUTTONS</li>
 *   <li>any option with an icon → ICON_PALETTE</li>
 *   <li>otherwise → DROPDOWN</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class RenderTypeResolver {

    private static final int MAX_RADIO_OPTIONS = 4;

    public RenderType resolve(OptionSet optionSet) {
        if (optionSet == null || optionSet.options().isEmpty()) {
            return RenderType.DEFAULT;
        }
        List<Option> options = optionSet.options();

        if (optionSet.isYesNo()) {
            return RenderType.YES_NO_BUTTONS;
        }
        if (options.size() <= MAX_RADIO_OPTIONS) {
            return RenderType.RADIO_BUTTONS;
        }
        if (options.stream().anyMatch(o -> o.icon() != null)) {
            return RenderType.ICON_PALETTE;
        }
        return RenderType.DROPDOWN;
    }

    /**
     * Render type of a single field: its option set if it has one, otherwise its value type.
     */
    public RenderType resolveForField(Field field) {
        if (field.optionSet() != null && !field.optionSet().options().isEmpty()) {
            return resolve(field.optionSet());
        }
        return switch (field.dataEntryType()) {
            case YES_NO -> RenderType.YES_NO_BUTTONS;
            case YES_ONLY -> RenderType.CHECKBOX;
            case TEXT, NUMBER, DATE, MULTIPLE_CHOICE, COORDINATES, PERCENTAGE, INTEGER, POSITIVE_INTEGER,
                 NEGATIVE_INTEGER, POSITIVE_NUMBER, NEGATIVE_NUMBER, PHONE_NUMBER -> RenderType.DEFAULT;
        };
    }

    /**
     * Render type of each member of a group, keyed by field id in member order.
     * Grid cells and flat or semantic members resolve on their own; radio and checkbox groups share the
     * render type of an option set built from their members' option labels.
     */
    public Map<String, RenderType> resolveForGroup(GroupingStrategy strategy) {
        Map<String, RenderType> byField = new LinkedHashMap<>();
        switch (strategy.groupType()) {
            case RADIO_GROUP, CHECKBOX_GROUP -> {
                RenderType shared = resolve(optionSetOf(strategy));
                strategy.members().forEach(f -> byField.putIfAbsent(f.id(), shared));
            }
            case DIMENSIONAL_GRID, SEMANTIC_CLUSTER, FLAT_LIST ->
                    strategy.members().forEach(f -> byField.putIfAbsent(f.id(), resolveForField(f)));
        }
        return byField;
    }

    /**
     * Option set whose options are the group members, labelled by what follows the group title.
     */
    public OptionSet optionSetOf(GroupingStrategy strategy) {
        List<Option> options = new ArrayList<>();
        int order = 0;
        for (Field member : strategy.members()) {
            String label = optionLabel(strategy.groupTitle(), member.name());
            options.add(Option.of(label, label, order++));
        }
        return new OptionSet(null, strategy.groupTitle(), options);
    }

    private static String optionLabel(String title, String name) {
        if (!title.isEmpty() && name.startsWith(title) && name.length() > title.length()) {
            String label = ExclusivityCandidateFinder.optionOf(title, name);
            if (!label.isEmpty()) {
                return label;
            }
        }
        return name;
    }
}
