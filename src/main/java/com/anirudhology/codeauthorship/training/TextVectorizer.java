package com.anirudhology.codeauthorship.training;

import weka.core.Instances;

import java.util.List;

/**
 * Turns joined token texts into feature vectors labelled with their author.
 */
public interface TextVectorizer {

    /**
     * @param texts  one space separated token text per example
     * @param labels master label of every example, parallel to texts
     * @return one instance per example, in input order, with the author as class attribute
     * @throws Exception when the underlying library fails
     */
    Instances vectorize(List<String> texts, List<Integer> labels) throws Exception;
}
