package com.anirudhology.codeauthorship.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Splits example positions into k folds that each mirror the overall label distribution.
 * <p>
 * Examples of every class are dealt round-robin over the folds, continuing
 * where the previous class stopped. Hence:
 * - every position lands in exactly one test fold
 * - per class, fold counts differ by at most one
 * - fold sizes differ by at most one
 */
public class StratifiedKFold {

    private static final Logger LOG = LoggerFactory.getLogger(StratifiedKFold.class);

    private final int numberOfFolds;
    private final boolean shuffle;
    private final Random random;

    public StratifiedKFold(int numberOfFolds) {
        this(numberOfFolds, false, null);
    }

    /**
     * @param numberOfFolds number of folds, at least 2
     * @param shuffle       permute each class before dealing it out
     * @param random        shared source of randomness, required when shuffling
     */
    public StratifiedKFold(int numberOfFolds, boolean shuffle, Random random) {
        if (numberOfFolds < 2) {
            throw new IllegalArgumentException("numberOfFolds must be at least 2, got: " + numberOfFolds);
        }
        if (shuffle && random == null) {
            throw new IllegalArgumentException("Shuffling folds requires a random source");
        }
        this.numberOfFolds = numberOfFolds;
        this.shuffle = shuffle;
        this.random = random;
    }

    public int numberOfFolds() {
        return this.numberOfFolds;
    }

    /**
     * @param labels label of every example
     * @return the folds, in fold order
     */
    public List<Fold> split(List<Integer> labels) {
        if (labels.size() < this.numberOfFolds) {
            throw new IllegalArgumentException("Cannot split " + labels.size() + " examples into "
                    + this.numberOfFolds + " folds");
        }

        final Map<Integer, List<Integer>> positionsByLabel = new TreeMap<>();
        for (int position = 0; position < labels.size(); position++) {
            positionsByLabel.computeIfAbsent(labels.get(position), k -> new ArrayList<>()).add(position);
        }

        final int[] foldOf = new int[labels.size()];
        int next = 0;
        for (Map.Entry<Integer, List<Integer>> entry : positionsByLabel.entrySet()) {
            final List<Integer> positions = entry.getValue();
            if (positions.size() < this.numberOfFolds) {
                LOG.warn("Label {} has only {} members, fewer than {} folds", entry.getKey(), positions.size(), this.numberOfFolds);
            }
            if (this.shuffle) {
                Collections.shuffle(positions, this.random);
            }
            for (Integer position : positions) {
                foldOf[position] = next % this.numberOfFolds;
                next++;
            }
        }

        final int[] testSizes = new int[this.numberOfFolds];
        for (int fold : foldOf) {
            testSizes[fold]++;
        }

        final List<Fold> folds = new ArrayList<>(this.numberOfFolds);
        for (int fold = 0; fold < this.numberOfFolds; fold++) {
            final int[] test = new int[testSizes[fold]];
            final int[] train = new int[labels.size() - testSizes[fold]];
            int t = 0;
            int r = 0;
            for (int position = 0; position < labels.size(); position++) {
                if (foldOf[position] == fold) {
                    test[t++] = position;
                } else {
                    train[r++] = position;
                }
            }
            folds.add(new Fold(fold, train, test));
        }
        return folds;
    }
}
