package com.anirudhology.codeauthorship.training;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CrossValidatorTest {

    /**
     * Reads the answer off the test instance, so any misalignment between
     * instances and labels shows up as lost accuracy.
     */
    private static final class OracleClassifier implements AuthorshipClassifier {

        @Override
        public void fit(Instances train) {
        }

        @Override
        public int[] predict(Instances test) {
            final int[] predictions = new int[test.numInstances()];
            for (int i = 0; i < predictions.length; i++) {
                predictions[i] = Integer.parseInt(test.classAttribute().value((int) test.instance(i).classValue()));
            }
            return predictions;
        }
    }

    private static final class FailingClassifier implements AuthorshipClassifier {

        @Override
        public void fit(Instances train) throws Exception {
            throw new Exception("fit failed");
        }

        @Override
        public int[] predict(Instances test) {
            return new int[0];
        }
    }

    private static List<Integer> labels() {
        final List<Integer> labels = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            labels.add(i % 3 == 0 ? 7 : i % 3 == 1 ? 4 : 9);
        }
        return labels;
    }

    private static Instances vectors(List<Integer> labels) throws Exception {
        final List<String> texts = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            texts.add("tok" + labels.get(i) + " file" + i);
        }
        return new TfidfVectorizer(null).vectorize(texts, labels);
    }

    @Test
    void runsOneFreshClassifierPerFold() throws Exception {
        final List<Integer> labels = labels();
        final AtomicInteger created = new AtomicInteger();

        final ExperimentResult result = new CrossValidator(() -> {
            created.incrementAndGet();
            return new OracleClassifier();
        }, new StratifiedKFold(4)).run(vectors(labels), labels);

        assertThat(created).hasValue(4);
        assertThat(result.folds()).hasSize(4).allSatisfy(fold -> {
            assertThat(fold.testSize()).isEqualTo(3);
            assertThat(fold.trainSize()).isEqualTo(9);
            assertThat(fold.accuracy()).isEqualTo(1.0);
        });
        assertThat(result.averageAccuracy()).isEqualTo(1.0);
        assertThat(result.averageF1()).isEqualTo(1.0);
    }

    @Test
    void classifierFailuresPropagate() throws Exception {
        final List<Integer> labels = labels();
        final Instances vectors = vectors(labels);
        final CrossValidator validator = new CrossValidator(FailingClassifier::new, new StratifiedKFold(3));

        assertThatThrownBy(() -> validator.run(vectors, labels)).hasMessage("fit failed");
    }

    @Test
    void rejectsMisalignedLabels() throws Exception {
        final List<Integer> labels = labels();
        final Instances vectors = vectors(labels);
        final CrossValidator validator = new CrossValidator(OracleClassifier::new, new StratifiedKFold(3));

        assertThatThrownBy(() -> validator.run(vectors, labels.subList(0, 6)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
