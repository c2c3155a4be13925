package com.fieldgrouping.infrastructure.grouping.exclusivity;

import com.fieldgrouping.domain.grouping.model.DataEntryType;
import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.Option;
import com.fieldgrouping.domain.grouping.model.OptionSet;
import com.fieldgrouping.infrastructure.grouping.tokenize.LabelNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.field;
import static com.fieldgrouping.infrastructure.grouping.GroupingFixtures.scoped;
import static org.assertj.core.api.Assertions.assertThat;

class ExclusivityCandidateFinderTest {

    private ExclusivityCandidateFinder finder;

    @BeforeEach
    void setUp() {
        finder = new ExclusivityCandidateFinder(new LabelNormalizer(), new SuffixPatternAnalyzer());
    }

    @Test
    @DisplayName("Fields sharing one YES/NO option set id form a candidate")
    void optionSet() {
        OptionSet yesNo = new OptionSet("yn", "Yes/No", List.of(Option.of("YES", "Yes"), Option.of("NO", "No")));
        OptionSet otherYesNo = new OptionSet("yn2", "Yes/No", List.of(Option.of("true", "Yes"), Option.of("false", "No")));
        List<ExclusivityCandidate> candidates = finder.byOptionSet(scoped(
                new Field("a", "Bednet use - Child", "S", null, DataEntryType.TEXT, null, yesNo),
                field("b", "Temperature"),
                new Field("c", "Bednet use - Mother", "S", null, DataEntryType.TEXT, null, yesNo),
                new Field("d", "Smokes", "S", null, DataEntryType.TEXT, null, otherYesNo)));

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.subject()).isEqualTo("Bednet use");
            assertThat(c.members()).extracting(m -> m.field().id()).containsExactly("a", "c");
            assertThat(c.options()).containsExactly("Child", "Mother");
            assertThat(c.pass()).isEqualTo(ExclusivityCandidateFinder.OPTION_SET_PASS);
        });
    }

    @Test
    @DisplayName("Option sets other than YES/NO are not a candidate")
    void otherOptionSet() {
        OptionSet colours = new OptionSet("col", "Colour", List.of(
                Option.of("R", "Red"), Option.of("G", "Green"), Option.of("B", "Blue")));

        assertThat(finder.byOptionSet(scoped(
                new Field("a", "Roof colour", "S", null, DataEntryType.TEXT, null, colours),
                new Field("b", "Wall colour", "S", null, DataEntryType.TEXT, null, colours)))).isEmpty();
    }

    @Test
    @DisplayName("Subject is the text before the last delimiter")
    void delimiter() {
        List<ExclusivityCandidate> candidates = finder.byDelimiter(scoped(
                field("a", "School Type - Public"),
                field("b", "School Type - Private"),
                field("c", "Temperature")));

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.subject()).isEqualTo("School Type");
            assertThat(c.options()).containsExactly("Public", "Private");
            assertThat(c.pass()).isEqualTo(ExclusivityCandidateFinder.DELIMITER_PASS);
        });
    }

    @Test
    @DisplayName("Parenthetical suffixes are options")
    void parenthetical() {
        List<ExclusivityCandidate> candidates = finder.byDelimiter(scoped(
                field("a", "Ownership (Government)"),
                field("b", "Ownership (Private)")));

        assertThat(candidates).singleElement()
                .satisfies(c -> assertThat(c.options()).containsExactly("Government", "Private"));
    }

    @Test
    @DisplayName("Longest shared multi-word prefix wins")
    void wordSequence() {
        List<ExclusivityCandidate> candidates = finder.byWordSequence(scoped(
                field("a", "Main water source piped"),
                field("b", "Main water source borehole")));

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.subject()).isEqualTo("Main water source");
            assertThat(c.options()).containsExactly("piped", "borehole");
        });
    }

    @Test
    @DisplayName("Single-word subjects need a supporting option shape")
    void singleWord() {
        assertThat(finder.bySingleWord(scoped(
                field("a", "Location Urban"),
                field("b", "Location Rural"))))
                .singleElement()
                .satisfies(c -> assertThat(c.subject()).isEqualTo("Location"));

        assertThat(finder.bySingleWord(scoped(
                field("a", "Record kept of visitors to the library"),
                field("b", "Record kept of meals served to pupils"))))
                .isEmpty();
    }

    @Test
    @DisplayName("Clusters need at least two fields")
    void singletonsDropped() {
        assertThat(finder.byDelimiter(scoped(field("a", "School Type - Public")))).isEmpty();
    }
}
