package com.fieldgrouping.infrastructure.grouping.tokenize;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LabelNormalizerTest {

    private LabelNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new LabelNormalizer();
    }

    @Test
    @DisplayName("null and empty become the empty string")
    void nullAndEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("Invisible characters are removed and whitespace collapsed")
    void invisibleAndWhitespace() {
        assertThat(normalizer.normalize("  Pupils\u200B Fed \n - P1  ")).isEqualTo("Pupils Fed - P1");
    }

    @Test
    @DisplayName("Non-breaking spaces count as whitespace")
    void nonBreakingSpace() {
        assertThat(normalizer.normalize("School\u00A0 Type")).isEqualTo("School Type");
    }

    @Test
    @DisplayName("Decomposed characters are composed (NFC)")
    void nfc() {
        assertThat(normalizer.normalize("Cafe\u0301")).isEqualTo("Caf\u00E9");
    }

    @Test
    @DisplayName("Control characters are dropped")
    void controlCharacters() {
        assertThat(normalizer.normalize("Weight\u0007 (kg)")).isEqualTo("Weight (kg)");
    }
}
