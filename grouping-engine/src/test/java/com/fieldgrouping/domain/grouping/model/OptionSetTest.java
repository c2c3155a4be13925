package com.fieldgrouping.domain.grouping.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OptionSetTest {

    @Test
    @DisplayName("Two boolean codes make a YES/NO set, in any case")
    void yesNo() {
        assertThat(new OptionSet("a", "A", List.of(Option.of("Yes", "Yes"), Option.of("NO", "No"))).isYesNo()).isTrue();
        assertThat(new OptionSet("b", "B", List.of(Option.of("1", "Yes"), Option.of("0", "No"))).isYesNo()).isTrue();
    }

    @Test
    @DisplayName("Other sizes, other codes or missing codes are not YES/NO")
    void notYesNo() {
        assertThat(new OptionSet("a", "A", List.of(Option.of("YES", "Yes"))).isYesNo()).isFalse();
        assertThat(new OptionSet("b", "B", List.of(Option.of("M", "Male"), Option.of("F", "Female"))).isYesNo()).isFalse();
        assertThat(new OptionSet("c", "C", List.of(Option.of(null, "Yes"), Option.of("NO", "No"))).isYesNo()).isFalse();
        assertThat(new OptionSet("d", "D", List.of(Option.of("yes", "Yes"), Option.of("no", "No"),
                Option.of("true", "True"))).isYesNo()).isFalse();
    }
}
