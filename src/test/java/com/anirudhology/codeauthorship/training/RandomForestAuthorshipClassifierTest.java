package com.anirudhology.codeauthorship.training;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RandomForestAuthorshipClassifierTest {

    @Test
    void learnsAuthorSpecificTokens() throws Exception {
        final List<String> texts = new ArrayList<>();
        final List<Integer> labels = new ArrayList<>();
        final String[] styles = {"printf scanf", "cout cin", "puts gets"};
        for (int author = 0; author < styles.length; author++) {
            for (int file = 0; file < 9; file++) {
                texts.add(styles[author] + " int main return");
                labels.add(author * 10);
            }
        }
        final Instances vectors = new TfidfVectorizer(null).vectorize(texts, labels);

        final RandomForestAuthorshipClassifier classifier = new RandomForestAuthorshipClassifier(20, 0);
        classifier.fit(vectors);
        final int[] predictions = classifier.predict(vectors);

        assertThat(predictions).containsExactly(labels.stream().mapToInt(Integer::intValue).toArray());
    }

    @Test
    void rejectsNonPositiveTreeCount() {
        assertThatThrownBy(() -> new RandomForestAuthorshipClassifier(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
