package com.fieldgrouping.infrastructure.grouping.render;

import com.fieldgrouping.domain.grouping.model.ConfidenceLevel;
import com.fieldgrouping.domain.grouping.model.DataEntryType;
import com.fieldgrouping.domain.grouping.model.ExclusivityEvidence;
import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.GroupType;
import com.fieldgrouping.domain.grouping.model.GroupingStrategy;
import com.fieldgrouping.domain.grouping.model.Option;
import com.fieldgrouping.domain.grouping.model.OptionSet;
import com.fieldgrouping.domain.grouping.model.RenderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.field;
import static org.assertj.core.api.Assertions.assertThat;

class RenderTypeResolverTest {

    private RenderTypeResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new RenderTypeResolver();
    }

    private static OptionSet plain(String... codes) {
        return new OptionSet("os", "Options",
                java.util.Arrays.stream(codes).map(c -> Option.of(c, c)).toList());
    }

    @Nested
    @DisplayName("Option sets")
    class OptionSets {

        @Test
        @DisplayName("YES/NO codes render as yes/no buttons, case-insensitively")
        void yesNo() {
            assertThat(resolver.resolve(plain("YES", "NO"))).isEqualTo(RenderType.YES_NO_BUTTONS);
            assertThat(resolver.resolve(plain("true", "False"))).isEqualTo(RenderType.YES_NO_BUTTONS);
            assertThat(resolver.resolve(plain("1", "0"))).isEqualTo(RenderType.YES_NO_BUTTONS);
        }

        @Test
        @DisplayName("Up to 4 options render as radio buttons")
        void radio() {
            assertThat(resolver.resolve(plain("YES", "MAYBE"))).isEqualTo(RenderType.RADIO_BUTTONS);
            assertThat(resolver.resolve(plain("A", "B", "C", "D"))).isEqualTo(RenderType.RADIO_BUTTONS);
        }

        @Test
        @DisplayName("Six plain options render as a dropdown")
        void dropdown() {
            assertThat(resolver.resolve(plain("A", "B", "C", "D", "E", "F"))).isEqualTo(RenderType.DROPDOWN);
        }

        @Test
        @DisplayName("Large sets with icons render as an icon palette")
        void icons() {
            List<Option> options = List.of(
                    new Option("a", "A", null, "ic_a", null, 0), Option.of("b", "B"), Option.of("c", "C"),
                    Option.of("d", "D"), Option.of("e", "E"));

            assertThat(resolver.resolve(new OptionSet("os", "Icons", options))).isEqualTo(RenderType.ICON_PALETTE);
        }

        @Test
        @DisplayName("Missing or empty option sets use the default control")
        void empty() {
            assertThat(resolver.resolve(null)).isEqualTo(RenderType.DEFAULT);
            assertThat(resolver.resolve(new OptionSet("os", "None", List.of()))).isEqualTo(RenderType.DEFAULT);
        }
    }

    @Nested
    @DisplayName("Fields and groups")
    class FieldsAndGroups {

        @Test
        @DisplayName("Fields without option sets fall back to their value type")
        void byValueType() {
            assertThat(resolver.resolveForField(field("a", "Fed", DataEntryType.YES_NO)))
                    .isEqualTo(RenderType.YES_NO_BUTTONS);
            assertThat(resolver.resolveForField(field("b", "Fed", DataEntryType.YES_ONLY)))
                    .isEqualTo(RenderType.CHECKBOX);
            assertThat(resolver.resolveForField(field("c", "Weight", DataEntryType.NUMBER)))
                    .isEqualTo(RenderType.DEFAULT);
        }

        @Test
        @DisplayName("Fields with option sets resolve from them")
        void byOptionSet() {
            Field field = new Field("a", "Water source", "S", null, DataEntryType.TEXT, null,
                    plain("TAP", "WELL", "RIVER", "RAIN", "TRUCK"));

            assertThat(resolver.resolveForField(field)).isEqualTo(RenderType.DROPDOWN);
        }

        @Test
        @DisplayName("Radio groups resolve from their members' option labels")
        void group() {
            GroupingStrategy strategy = new GroupingStrategy(ConfidenceLevel.MEDIUM, GroupType.RADIO_GROUP,
                    "Fed today",
                    List.of(field("y", "Fed today - Yes", DataEntryType.YES_ONLY),
                            field("n", "Fed today - No", DataEntryType.YES_ONLY)),
                    new ExclusivityEvidence(0.8, 0.8, "Mutual Exclusivity (delimiter)", List.of()));

            assertThat(resolver.optionSetOf(strategy).options()).extracting(Option::code)
                    .containsExactly("Yes", "No");
            Map<String, RenderType> byField = resolver.resolveForGroup(strategy);
            assertThat(byField).containsEntry("y", RenderType.YES_NO_BUTTONS).containsEntry("n", RenderType.YES_NO_BUTTONS);
        }
    }
}
