package com.anirudhology.codeauthorship.training;

import weka.classifiers.trees.RandomForest;
import weka.core.Instances;

/**
 * Baseline classifier: a Weka random forest of fully grown trees.
 */
public class RandomForestAuthorshipClassifier implements AuthorshipClassifier {

    public static final int DEFAULT_TREES = 100;

    private final RandomForest forest;

    public RandomForestAuthorshipClassifier() {
        this(DEFAULT_TREES, 0);
    }

    public RandomForestAuthorshipClassifier(int trees, int seed) {
        if (trees <= 0) {
            throw new IllegalArgumentException("trees must be positive, got: " + trees);
        }
        this.forest = new RandomForest();
        this.forest.setNumIterations(trees);
        this.forest.setMaxDepth(0); // unlimited
        this.forest.setSeed(seed);
        this.forest.setNumExecutionSlots(1);
    }

    @Override
    public void fit(Instances train) throws Exception {
        this.forest.buildClassifier(train);
    }

    @Override
    public int[] predict(Instances test) throws Exception {
        final int[] predictions = new int[test.numInstances()];
        for (int i = 0; i < test.numInstances(); i++) {
            final double classIndex = this.forest.classifyInstance(test.instance(i));
            predictions[i] = Integer.parseInt(test.classAttribute().value((int) classIndex));
        }
        return predictions;
    }
}
