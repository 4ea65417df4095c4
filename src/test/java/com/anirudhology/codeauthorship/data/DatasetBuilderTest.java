package com.anirudhology.codeauthorship.data;

import com.anirudhology.codeauthorship.tokenizer.TokenFilterOptions;
import com.anirudhology.codeauthorship.types.Example;
import com.anirudhology.codeauthorship.types.Language;
import com.anirudhology.codeauthorship.types.TokenRecord;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.anirudhology.codeauthorship.data.TestExamples.example;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DatasetBuilderTest {

    private static final List<Example> EXAMPLES = List.of(
            new Example("zoe", "0", List.of(new TokenRecord("Print", "NAME"), new TokenRecord("(", "OP"))),
            new Example("adam", "1", List.of(new TokenRecord("X", "NAME"), new TokenRecord("=", "OP"))),
            new Example("zoe", "2", List.of(new TokenRecord("RETURN", "NAME")))
    );

    @Test
    void lowercasesTokensAndKeepsExampleOrder() {
        final Dataset dataset = new DatasetBuilder(Language.PYTHON, TokenFilterOptions.none(), false).build(EXAMPLES);

        assertThat(dataset.primary()).containsExactly(List.of("print", "("), List.of("x", "="), List.of("return"));
        assertThat(dataset.exampleIds()).containsExactly("0", "1", "2");
    }

    @Test
    void labelsFollowSortedUsernames() {
        final Dataset dataset = new DatasetBuilder(Language.PYTHON, TokenFilterOptions.none(), false).build(EXAMPLES);

        assertThat(dataset.label2idx()).containsEntry("adam", 0).containsEntry("zoe", 1).hasSize(2);
        assertThat(dataset.labels()).containsExactly(1, 0, 1);
        assertThat(dataset.numberOfClasses()).isEqualTo(2);
    }

    @Test
    void secondaryFieldsStayAlignedWithPrimaryData() {
        final Dataset dataset = new DatasetBuilder(Language.C, TokenFilterOptions.none(), true).build(EXAMPLES);

        assertThat(dataset.labels()).hasSameSizeAs(dataset.primary());
        assertThat(dataset.exampleIds()).hasSameSizeAs(dataset.primary());
        assertThat(dataset.languages()).hasSameSizeAs(dataset.primary()).containsOnly(Language.C);
        assertThat(dataset.seqTypes()).hasSameSizeAs(dataset.primary());
        assertThat(dataset.language()).isEqualTo(Language.C);
    }

    @Test
    void exportsTypesOfRetainedTokens() {
        final TokenFilterOptions noOperators = new TokenFilterOptions(Set.of(), Set.of("OP"), false, false, null);

        final Dataset dataset = new DatasetBuilder(Language.PYTHON, noOperators, true).build(EXAMPLES);

        assertThat(dataset.primary()).containsExactly(List.of("print"), List.of("x"), List.of("return"));
        assertThat(dataset.seqTypes()).containsExactly(List.of("NAME"), List.of("NAME"), List.of("NAME"));
    }

    @Test
    void typesAreUnavailableWithoutExport() {
        final Dataset dataset = new DatasetBuilder(Language.PYTHON, TokenFilterOptions.none(), false).build(EXAMPLES);

        assertThat(dataset.hasSeqTypes()).isFalse();
        assertThatThrownBy(dataset::seqTypes).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void authorUsageIsComputedOverTheBatch() {
        final List<Example> examples = List.of(
                example("alice", "0", "for", "alice_only"),
                example("bob", "1", "for", "bob_only"));
        final TokenFilterOptions shared = new TokenFilterOptions(Set.of(), Set.of(), false, false, 2);

        final Dataset dataset = new DatasetBuilder(Language.PYTHON, shared, false).build(examples);

        assertThat(dataset.primary()).containsExactly(List.of("for"), List.of("for"));
    }

    @Test
    void filteringCanEmptyAnExampleWithoutDroppingIt() {
        final TokenFilterOptions reservedOnly = new TokenFilterOptions(Set.of(), Set.of(), true, false, null);

        final Dataset dataset = new DatasetBuilder(Language.PYTHON, reservedOnly, false)
                .build(List.of(example("alice", "0", "foo", "bar")));

        assertThat(dataset.primary()).containsExactly(List.of());
        assertThat(dataset.size()).isEqualTo(1);
    }

    @Test
    void vocabularySizeCountsDistinctValues() {
        final Dataset dataset = new DatasetBuilder(Language.PYTHON, TokenFilterOptions.none(), false)
                .build(List.of(example("a", "0", "x", "y"), example("b", "1", "y", "z")));

        assertThat(dataset.vocabularySize()).isEqualTo(3);
    }

    @Test
    void misalignedSecondaryFieldsAreRejected() {
        assertThatThrownBy(() -> new Dataset(List.of(List.of("a")), List.of("0", "1"), List.of(0), null,
                Map.of("alice", 0), Language.PYTHON))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("example_ids");
    }
}
