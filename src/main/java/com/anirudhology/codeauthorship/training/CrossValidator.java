package com.anirudhology.codeauthorship.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs k-fold cross-validation of a fresh classifier per fold.
 */
public class CrossValidator {

    private static final Logger LOG = LoggerFactory.getLogger(CrossValidator.class);

    private final Supplier<AuthorshipClassifier> classifierFactory;
    private final StratifiedKFold splitter;

    public CrossValidator(Supplier<AuthorshipClassifier> classifierFactory, StratifiedKFold splitter) {
        this.classifierFactory = classifierFactory;
        this.splitter = splitter;
    }

    /**
     * @param vectors one vectorized instance per example
     * @param labels  master label of every example, parallel to vectors
     * @return per-fold scores
     * @throws Exception when training or prediction fails
     */
    public ExperimentResult run(Instances vectors, List<Integer> labels) throws Exception {
        if (vectors.numInstances() != labels.size()) {
            throw new IllegalArgumentException("Got " + vectors.numInstances() + " instances for " + labels.size() + " labels");
        }

        final List<FoldResult> results = new ArrayList<>();
        for (Fold fold : this.splitter.split(labels)) {
            final Instances train = subset(vectors, fold.trainIndices());
            final Instances test = subset(vectors, fold.testIndices());

            final AuthorshipClassifier classifier = this.classifierFactory.get();
            classifier.fit(train);
            final int[] predictions = classifier.predict(test);

            final FrequencyMetrics.Scores scores = FrequencyMetrics.evaluate(
                    select(labels, fold.trainIndices()), toArray(select(labels, fold.testIndices())), predictions);

            LOG.info(String.format("fold=%d train-size=%d test-size=%d acc=%.3f f1=%.3f",
                    fold.index(), train.numInstances(), test.numInstances(), scores.accuracy(), scores.averageF1()));
            results.add(new FoldResult(fold.index(), train.numInstances(), test.numInstances(),
                    scores.accuracy(), scores.averageF1()));
        }

        final ExperimentResult result = new ExperimentResult(results);
        LOG.info(String.format("average-acc=%.3f average-f1=%.3f", result.averageAccuracy(), result.averageF1()));
        return result;
    }

    private static Instances subset(Instances data, int[] indices) {
        final Instances subset = new Instances(data, indices.length);
        for (int index : indices) {
            subset.add(data.instance(index));
        }
        return subset;
    }

    private static List<Integer> select(List<Integer> values, int[] indices) {
        final List<Integer> selected = new ArrayList<>(indices.length);
        for (int index : indices) {
            selected.add(values.get(index));
        }
        return selected;
    }

    private static int[] toArray(List<Integer> values) {
        final int[] array = new int[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
