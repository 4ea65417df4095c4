package com.anirudhology.codeauthorship.training;

/**
 * @param fold      0-based fold number
 * @param trainSize number of training examples
 * @param testSize  number of held out examples
 * @param accuracy  accuracy on the held out examples
 * @param averageF1 frequency-bucketed F1 on the held out examples
 */
public record FoldResult(int fold, int trainSize, int testSize, double accuracy, double averageF1) {
}
