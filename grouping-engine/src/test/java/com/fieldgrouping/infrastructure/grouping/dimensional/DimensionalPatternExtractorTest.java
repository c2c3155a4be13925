package com.fieldgrouping.infrastructure.grouping.dimensional;

import com.fieldgrouping.domain.grouping.model.Dimension;
import com.fieldgrouping.domain.grouping.model.DataEntryType;
import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.GroupType;
import com.fieldgrouping.domain.grouping.model.InferredCategoryCombo;
import com.fieldgrouping.infrastructure.grouping.Resolution;
import com.fieldgrouping.infrastructure.grouping.ScopedField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.dimensionalExtractor;
import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.eightAxisLabels;
import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.field;
import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.pupilsFed;
import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.pupilsFedWithDisabled;
import static org.assertj.core.api.Assertions.assertThat;

class DimensionalPatternExtractorTest {

    private DimensionalPatternExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = dimensionalExtractor();
    }

    private static List<ScopedField> scoped(List<Field> fields) {
        List<ScopedField> scoped = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            scoped.add(new ScopedField(i, fields.get(i)));
        }
        return scoped;
    }

    @Nested
    @DisplayName("Complete grids")
    class CompleteGrids {

        @Test
        @DisplayName("Grade x Gender labels form one 2-dimensional grid")
        void gradeByGender() {
            List<Resolution> result = extractor.extract(scoped(pupilsFed()));

            assertThat(result).hasSize(1);
            Resolution grid = result.get(0);
            assertThat(grid.groupType()).isEqualTo(GroupType.DIMENSIONAL_GRID);
            assertThat(grid.title()).isEqualTo("Pupils Fed");
            assertThat(grid.members()).hasSize(4);

            List<Dimension> dimensions = grid.metadata().dimensionalPattern().dimensions();
            assertThat(dimensions).extracting(Dimension::name).containsExactly("Grade", "Gender");
            assertThat(dimensions).extracting(Dimension::order).containsExactly(1, 2);
            assertThat(dimensions.get(0).values()).containsExactly("P1", "P2");
            assertThat(dimensions.get(1).values()).containsExactly("Male", "Female");

            InferredCategoryCombo combo = grid.metadata().inferredCategoryCombo();
            assertThat(combo.totalExpectedCombinations()).isEqualTo(4);
            assertThat(combo.actualCombinations()).isEqualTo(4);
            assertThat(combo.completenessRatio()).isEqualTo(1.0);
            assertThat(combo.isConditional()).isFalse();
        }

        @Test
        @DisplayName("Parenthetical labels are tokenized too")
        void parenthetical() {
            List<Field> fields = List.of(
                    field("a", "Pupils Fed (P1 Male)"),
                    field("b", "Pupils Fed (P1 Female)"),
                    field("c", "Pupils Fed (P2 Male)"),
                    field("d", "Pupils Fed (P2 Female)"));

            List<Resolution> result = extractor.extract(scoped(fields));

            assertThat(result).hasSize(1);
            assertThat(result.get(0).title()).isEqualTo("Pupils Fed");
            assertThat(result.get(0).metadata().dimensionalPattern().dimensions())
                    .extracting(Dimension::name).containsExactly("Grade", "Gender");
        }

        @Test
        @DisplayName("Each base name becomes its own grid; unrelated fields stay unclaimed")
        void twoClusters() {
            List<Field> fields = new ArrayList<>(pupilsFed());
            fields.add(field("t1", "Teachers - P1 - Male"));
            fields.add(field("t2", "Teachers - P1 - Female"));
            fields.add(field("c", "Comments"));
            fields.add(field("t3", "Teachers - P2 - Male"));
            fields.add(field("t4", "Teachers - P2 - Female"));

            List<Resolution> result = extractor.extract(scoped(fields));

            assertThat(result).extracting(Resolution::title).containsExactly("Pupils Fed", "Teachers");
            assertThat(result).flatExtracting(Resolution::members)
                    .extracting(s -> s.field().id())
                    .doesNotContain("c");
        }
    }

    @Nested
    @DisplayName("Conditional structures")
    class Conditional {

        @Test
        @DisplayName("A value without a Gender axis makes the combo conditional")
        void disabledHasNoGender() {
            List<Resolution> result = extractor.extract(scoped(pupilsFedWithDisabled()));

            assertThat(result).hasSize(1);
            InferredCategoryCombo combo = result.get(0).metadata().inferredCategoryCombo();
            assertThat(result.get(0).members()).hasSize(5);
            assertThat(combo.isConditional()).isTrue();
            assertThat(combo.conditionalRules()).hasSize(1);
            assertThat(combo.conditionalRules().get(0)).contains("Disabled").contains("Gender");
            assertThat(combo.totalExpectedCombinations()).isEqualTo(6);
            assertThat(combo.actualCombinations()).isEqualTo(5);
            assertThat(combo.completenessRatio()).isLessThan(1.0).isGreaterThan(0.0);
        }
    }

    @Nested
    @DisplayName("Not dimensional")
    class NotDimensional {

        @Test
        @DisplayName("A single varying axis is left for later stages")
        void singleAxis() {
            List<Field> fields = List.of(
                    field("a", "Cases - Male", DataEntryType.YES_ONLY),
                    field("b", "Cases - Female", DataEntryType.YES_ONLY));

            assertThat(extractor.extract(scoped(fields))).isEmpty();
        }

        @Test
        @DisplayName("Unstructured labels give nothing")
        void flat() {
            List<Field> fields = List.of(field("a", "Temperature"), field("b", "Weight"));

            assertThat(extractor.extract(scoped(fields))).isEmpty();
        }

        @Test
        @DisplayName("Axes whose combinations exceed the int range are not a grid")
        void tooManyCombinations() {
            assertThat(extractor.extract(scoped(eightAxisLabels()))).isEmpty();
        }

        @Test
        @DisplayName("Fewer than two fields give nothing")
        void tooFew() {
            assertThat(extractor.extract(scoped(List.of(field("a", "Pupils Fed - P1 - Male"))))).isEmpty();
        }
    }

    @Test
    @DisplayName("Dimension names and order do not depend on input order")
    void orderIndependentNaming() {
        List<Field> reversed = new ArrayList<>(pupilsFed());
        Collections.reverse(reversed);

        List<Dimension> forward = extractor.extract(scoped(pupilsFed())).get(0)
                .metadata().dimensionalPattern().dimensions();
        List<Dimension> backward = extractor.extract(scoped(reversed)).get(0)
                .metadata().dimensionalPattern().dimensions();

        assertThat(backward).extracting(Dimension::name).isEqualTo(forward.stream().map(Dimension::name).toList());
        assertThat(backward).extracting(Dimension::order).isEqualTo(forward.stream().map(Dimension::order).toList());
    }
}
