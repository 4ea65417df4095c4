package com.anirudhology.codeauthorship.training;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import weka.core.Attribute;
import weka.core.Instances;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TfidfVectorizerTest {

    private static final List<String> TEXTS = List.of("for i in range", "for x in xs", "while true");
    private static final List<Integer> LABELS = List.of(3, 5, 3);

    @Test
    void keepsOneInstancePerTextWithAuthorClass() throws Exception {
        final Instances vectors = new TfidfVectorizer(null).vectorize(TEXTS, LABELS);

        assertThat(vectors.numInstances()).isEqualTo(3);
        assertThat(vectors.classAttribute().name()).isEqualTo(TfidfVectorizer.CLASS_ATTRIBUTE);
        for (int i = 0; i < vectors.numInstances(); i++) {
            final String label = vectors.classAttribute().value((int) vectors.instance(i).classValue());
            assertThat(Integer.parseInt(label)).isEqualTo(LABELS.get(i));
        }
    }

    @Test
    void weightsRareTokensAboveCommonOnes() throws Exception {
        final Instances vectors = new TfidfVectorizer(null).vectorize(TEXTS, LABELS);

        final Attribute range = vectors.attribute("tok:range");
        final Attribute forToken = vectors.attribute("tok:for");
        assertThat(range).isNotNull();
        assertThat(forToken).isNotNull();
        // "range" only occurs in the first text, "for" in two of three
        assertThat(vectors.instance(0).value(range)).isGreaterThan(vectors.instance(0).value(forToken));
        assertThat(vectors.instance(1).value(range)).isZero();
    }

    @Test
    void punctuationTokensAreKept() throws Exception {
        final Instances vectors = new TfidfVectorizer(null).vectorize(
                List.of("( ) ;", "x = ( y )", "{ }"), List.of(0, 1, 0));

        assertThat(vectors.attribute("tok:(")).isNotNull();
        assertThat(vectors.attribute("tok:;")).isNotNull();
    }

    @Test
    void maxFeaturesKeepsTheMostFrequentTokens() throws Exception {
        final Instances vectors = new TfidfVectorizer(1).vectorize(
                List.of("a b", "a c", "a d"), List.of(0, 1, 0));

        // one token attribute plus the class
        assertThat(vectors.numAttributes()).isEqualTo(2);
        assertThat(vectors.attribute("tok:a")).isNotNull();
    }

    @Test
    void rejectsMisalignedInput() {
        assertThatThrownBy(() -> new TfidfVectorizer(null).vectorize(List.of("a"), List.of(0, 1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TfidfVectorizer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
