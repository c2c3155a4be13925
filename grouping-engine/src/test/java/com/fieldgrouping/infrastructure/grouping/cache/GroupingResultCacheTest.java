package com.fieldgrouping.infrastructure.grouping.cache;

import com.fieldgrouping.domain.grouping.model.DataEntryType;
import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.GroupingStrategy;
import com.fieldgrouping.domain.grouping.model.Option;
import com.fieldgrouping.domain.grouping.model.OptionSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.field;
import static org.assertj.core.api.Assertions.assertThat;

class GroupingResultCacheTest {

    private GroupingCacheKeyBuilder keyBuilder;

    @BeforeEach
    void setUp() {
        keyBuilder = new GroupingCacheKeyBuilder();
    }

    @Nested
    @DisplayName("Cache keys")
    class Keys {

        @Test
        @DisplayName("Same fields give the same 64-char hex key")
        void deterministic() {
            List<Field> fields = List.of(field("a", "Weight"), field("b", "Height"));

            String key = keyBuilder.buildKey("S", fields);
            assertThat(key).hasSize(64).matches("[0-9a-f]+");
            assertThat(keyBuilder.buildKey("S", List.of(field("a", "Weight"), field("b", "Height")))).isEqualTo(key);
        }

        @Test
        @DisplayName("Order, scope and value type are part of the key")
        void sensitive() {
            String key = keyBuilder.buildKey("S", List.of(field("a", "Weight"), field("b", "Height")));

            assertThat(keyBuilder.buildKey("S", List.of(field("b", "Height"), field("a", "Weight")))).isNotEqualTo(key);
            assertThat(keyBuilder.buildKey("T", List.of(field("a", "Weight"), field("b", "Height")))).isNotEqualTo(key);
            assertThat(keyBuilder.buildKey("S", List.of(field("a", "Weight", DataEntryType.NUMBER),
                    field("b", "Height")))).isNotEqualTo(key);
        }

        @Test
        @DisplayName("Pipes inside names and sections cannot shift a component into its neighbour")
        void delimiterInValues() {
            String pipeInName = keyBuilder.buildKey("S", List.of(
                    new Field("a", "A|B", "", null, DataEntryType.TEXT, null)));
            String pipeInSection = keyBuilder.buildKey("S", List.of(
                    new Field("a", "A", "B|", null, DataEntryType.TEXT, null)));

            assertThat(pipeInName).isNotEqualTo(pipeInSection);
        }

        @Test
        @DisplayName("The option set is part of the key")
        void optionSet() {
            OptionSet yesNo = new OptionSet("yn", "Yes/No", List.of(Option.of("YES", "Yes"), Option.of("NO", "No")));
            OptionSet otherYesNo = new OptionSet("yn2", "Yes/No", yesNo.options());

            String key = keyBuilder.buildKey("S", List.of(
                    new Field("a", "Smokes", "S", null, DataEntryType.TEXT, null, yesNo)));

            assertThat(keyBuilder.buildKey("S", List.of(
                    new Field("a", "Smokes", "S", null, DataEntryType.TEXT, null, otherYesNo)))).isNotEqualTo(key);
            assertThat(keyBuilder.buildKey("S", List.of(
                    new Field("a", "Smokes", "S", null, DataEntryType.TEXT, null)))).isNotEqualTo(key);
        }
    }

    @Test
    @DisplayName("Results are computed once until invalidated")
    void computeOnce() {
        GroupingResultCache cache = new GroupingResultCache();
        AtomicInteger computations = new AtomicInteger();
        List<GroupingStrategy> strategies = List.of(GroupingStrategy.flat(field("a", "Weight"), List.of()));

        cache.getOrCompute("k", () -> {
            computations.incrementAndGet();
            return strategies;
        });
        List<GroupingStrategy> second = cache.getOrCompute("k", () -> {
            computations.incrementAndGet();
            return List.of();
        });

        assertThat(second).isEqualTo(strategies);
        assertThat(computations).hasValue(1);

        cache.invalidateAll();
        assertThat(cache.size()).isZero();
        assertThat(cache.get("k")).isEmpty();
    }
}
