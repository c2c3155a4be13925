package com.fieldgrouping.infrastructure.grouping.dimensional;

import com.fieldgrouping.domain.grouping.model.CategoryPattern;
import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.ImpliedCategory;
import com.fieldgrouping.domain.grouping.model.ImpliedCategoryCombination;
import com.fieldgrouping.domain.grouping.model.ImpliedCategoryMapping;
import com.fieldgrouping.infrastructure.grouping.GroupingFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.field;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImpliedCategoryInferenceServiceTest {

    private ImpliedCategoryInferenceService service;

    private final List<Field> anc = List.of(
            field("w1", "ANC - First Visit - Weight"),
            field("h1", "ANC - First Visit - Height"),
            field("w2", "ANC - Second Visit - Weight"),
            field("h2", "ANC - Second Visit - Height"),
            field("w3", "PNC - First Visit - Weight"));

    @BeforeEach
    void setUp() {
        service = new ImpliedCategoryInferenceService(GroupingFixtures.tokenizer(), new DimensionNamer());
    }

    @Nested
    @DisplayName("Structure inference")
    class Inference {

        @Test
        @DisplayName("Every non-final level becomes a category")
        void levels() {
            ImpliedCategoryCombination combination = service.inferCategoryStructure(anc, "ANC").orElseThrow();

            assertThat(combination.pattern()).isEqualTo(CategoryPattern.HIERARCHICAL);
            assertThat(combination.totalFields()).isEqualTo(5);
            assertThat(combination.structuredFields()).isEqualTo(5);
            assertThat(combination.categories()).extracting(ImpliedCategory::level).containsExactly(0, 1);
            assertThat(combination.categories().get(0).options()).containsExactly("ANC", "PNC");
            assertThat(combination.categories().get(1).options()).containsExactly("First Visit", "Second Visit");
            assertThat(combination.confidence()).isCloseTo(0.5 + 0.3 + (2.0 / 3.0) * 0.2, within(1e-9));
        }

        @Test
        @DisplayName("Unstructured sections have no implied structure")
        void flat() {
            assertThat(service.inferCategoryStructure(List.of(field("a", "Temperature"), field("b", "Weight")), "S"))
                    .isEmpty();
            assertThat(service.inferCategoryStructure(List.of(), "S")).isEmpty();
        }

        @Test
        @DisplayName("Levels whose values are all distinct are not categories")
        void allDistinct() {
            List<Field> fields = List.of(field("a", "A - x"), field("b", "B - y"), field("c", "C - z"));

            assertThat(service.inferCategoryStructure(fields, "S")).isEmpty();
        }
    }

    @Test
    @DisplayName("Mappings carry per-level options and group by option tuple")
    void mappingsAndGrouping() {
        ImpliedCategoryCombination combination = service.inferCategoryStructure(anc, "ANC").orElseThrow();

        List<ImpliedCategoryMapping> mappings = service.createMappings(anc, combination);
        assertThat(mappings).hasSize(5);
        assertThat(mappings.get(0).categoryOptionsByLevel()).containsEntry(0, "ANC").containsEntry(1, "First Visit");
        assertThat(mappings.get(0).fieldName()).isEqualTo("Weight");

        Map<List<String>, List<ImpliedCategoryMapping>> grouped = service.groupByImpliedCategories(mappings, combination);
        assertThat(grouped.keySet()).containsExactly(
                List.of("ANC", "First Visit"), List.of("ANC", "Second Visit"), List.of("PNC", "First Visit"));
        assertThat(grouped.get(List.of("ANC", "First Visit"))).extracting(ImpliedCategoryMapping::fieldId)
                .containsExactly("w1", "h1");
    }
}
