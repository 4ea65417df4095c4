package com.anirudhology.codeauthorship.training;

/**
 * One train/test split of a k-fold partition.
 *
 * @param index        0-based fold number
 * @param trainIndices example positions used for training, ascending
 * @param testIndices  example positions held out, ascending
 */
public record Fold(int index, int[] trainIndices, int[] testIndices) {
}
