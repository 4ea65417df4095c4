package com.anirudhology.codeauthorship.training;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accuracy and frequency-bucketed F1 of a set of predictions.
 * <p>
 * Every label is put in the bucket of its training frequency (labels absent
 * from training fall in bucket 0). A correct prediction is a true positive
 * of the true label's bucket; a wrong one is a false negative of the true
 * label's bucket and a false positive of the predicted label's bucket.
 * The reported F1 is the unweighted mean of the per-bucket F1 scores.
 */
public final class FrequencyMetrics {

    /**
     * @param accuracy  fraction of correct predictions
     * @param averageF1 mean F1 over frequency buckets
     */
    public record Scores(double accuracy, double averageF1) {
    }

    private FrequencyMetrics() {
    }

    public static Scores evaluate(List<Integer> trainLabels, int[] testLabels, int[] predictions) {
        if (testLabels.length != predictions.length) {
            throw new IllegalArgumentException("Got " + predictions.length + " predictions for " + testLabels.length + " labels");
        }
        if (testLabels.length == 0) {
            throw new IllegalArgumentException("Cannot score an empty test set");
        }

        final Map<Integer, Integer> labelFrequency = new HashMap<>();
        for (Integer label : trainLabels) {
            labelFrequency.merge(label, 1, Integer::sum);
        }

        // bucket -> {true positives, false positives, false negatives}
        final Map<Integer, int[]> buckets = new TreeMap<>();
        int correct = 0;
        for (int i = 0; i < testLabels.length; i++) {
            final int[] trueBucket = buckets.computeIfAbsent(labelFrequency.getOrDefault(testLabels[i], 0), k -> new int[3]);
            final int[] predictedBucket = buckets.computeIfAbsent(labelFrequency.getOrDefault(predictions[i], 0), k -> new int[3]);
            if (testLabels[i] == predictions[i]) {
                trueBucket[0]++;
                correct++;
            } else {
                trueBucket[2]++;
                predictedBucket[1]++;
            }
        }

        double f1Sum = 0.0;
        for (int[] counts : buckets.values()) {
            f1Sum += f1(counts[0], counts[1], counts[2]);
        }
        return new Scores((double) correct / testLabels.length, f1Sum / buckets.size());
    }

    static double f1(int truePositives, int falsePositives, int falseNegatives) {
        final double precision = truePositives + falsePositives > 0
                ? (double) truePositives / (truePositives + falsePositives) : 0.0;
        final double recall = truePositives + falseNegatives > 0
                ? (double) truePositives / (truePositives + falseNegatives) : 0.0;
        return precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;
    }
}
