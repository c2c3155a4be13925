package com.fieldgrouping.infrastructure.grouping.exclusivity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SuffixPatternAnalyzerTest {

    private SuffixPatternAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SuffixPatternAnalyzer();
    }

    @Nested
    @DisplayName("Signals raising the score")
    class Raising {

        @Test
        @DisplayName("Negation pair with taxonomy terms saturates at 1")
        void negation() {
            assertThat(analyzer.analyze(List.of("Licensed", "Not licensed"))).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Numeric enumeration of short proper options")
        void numericEnumeration() {
            assertThat(analyzer.analyze(List.of("Type 1", "Type 2", "Type 3"))).isCloseTo(0.9, within(1e-9));
        }

        @Test
        @DisplayName("Letter enumeration")
        void letterEnumeration() {
            assertThat(analyzer.analyze(List.of("Option A", "Option B"))).isCloseTo(0.6, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Signals lowering the score")
    class Lowering {

        @Test
        @DisplayName("Attribute words push the score to 0")
        void attributes() {
            assertThat(analyzer.analyze(List.of("water available", "power available"))).isZero();
        }

        @Test
        @DisplayName("Options repeating a word are still checked for attribute words")
        void repeatedWords() {
            assertThat(analyzer.analyze(List.of("Tap water or rain water", "Borehole"))).isCloseTo(0.1, within(1e-9));
            assertThat(analyzer.analyze(List.of("Working pump is working", "Hand pump"))).isZero();
        }

        @Test
        @DisplayName("Compound options push the score to 0")
        void compound() {
            assertThat(analyzer.analyze(List.of("tap and well", "river"))).isZero();
        }
    }

    @Test
    @DisplayName("Enumeration detection needs at least 2 numbered options")
    void enumerationDetection() {
        assertThat(analyzer.isNumericEnumeration(List.of("a", "b"))).isFalse();
        assertThat(analyzer.isNumericEnumeration(List.of("Visit 1", "Visit 3"))).isTrue();
        assertThat(analyzer.isLetterEnumeration(List.of("Block A", "Block B", "Block C"))).isTrue();
    }
}
