package com.anirudhology.codeauthorship.training;

import weka.core.Instances;

/**
 * Classifier trained and evaluated once per cross-validation fold.
 */
public interface AuthorshipClassifier {

    void fit(Instances train) throws Exception;

    /**
     * @param test instances sharing the training header
     * @return predicted master label of every test instance, in order
     */
    int[] predict(Instances test) throws Exception;
}
