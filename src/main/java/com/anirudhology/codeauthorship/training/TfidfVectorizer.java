package com.anirudhology.codeauthorship.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instances;
import weka.core.tokenizers.WordTokenizer;
import weka.filters.Filter;
import weka.filters.unsupervised.attribute.StringToWordVector;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * TF-IDF bag of tokens backed by Weka's {@link StringToWordVector}.
 * <p>
 * Texts are split on single spaces only, since tokens were lowercased when
 * the dataset was built and may contain punctuation.
 */
public class TfidfVectorizer implements TextVectorizer {

    private static final Logger LOG = LoggerFactory.getLogger(TfidfVectorizer.class);

    static final String TEXT_ATTRIBUTE = "@text@";
    static final String CLASS_ATTRIBUTE = "@author@";

    // Keeps token attributes apart from the two attributes above
    private static final String TOKEN_PREFIX = "tok:";

    // Null keeps the whole vocabulary
    private final Integer maxFeatures;

    public TfidfVectorizer(Integer maxFeatures) {
        if (maxFeatures != null && maxFeatures <= 0) {
            throw new IllegalArgumentException("maxFeatures must be positive, got: " + maxFeatures);
        }
        this.maxFeatures = maxFeatures;
    }

    @Override
    public Instances vectorize(List<String> texts, List<Integer> labels) throws Exception {
        if (texts.size() != labels.size()) {
            throw new IllegalArgumentException("Got " + texts.size() + " texts for " + labels.size() + " labels");
        }
        final Instances raw = toInstances(texts, labels);

        final WordTokenizer tokenizer = new WordTokenizer();
        tokenizer.setDelimiters(" ");

        final StringToWordVector filter = new StringToWordVector();
        filter.setTokenizer(tokenizer);
        filter.setAttributeNamePrefix(TOKEN_PREFIX);
        filter.setOutputWordCounts(true);
        filter.setTFTransform(true);
        filter.setIDFTransform(true);
        filter.setLowerCaseTokens(false);
        filter.setDoNotOperateOnPerClassBasis(true);
        filter.setWordsToKeep(this.maxFeatures == null ? Integer.MAX_VALUE : this.maxFeatures);
        filter.setInputFormat(raw);

        final Instances vectors = Filter.useFilter(raw, filter);
        LOG.info("tfidf data: {} examples x {} features", vectors.numInstances(), vectors.numAttributes() - 1);
        return vectors;
    }

    /**
     * Builds the string/nominal input table the filter expects
     */
    static Instances toInstances(List<String> texts, List<Integer> labels) {
        final List<String> classValues = new ArrayList<>();
        for (Integer label : new TreeSet<>(labels)) {
            classValues.add(String.valueOf(label));
        }

        final ArrayList<Attribute> attributes = new ArrayList<>(2);
        attributes.add(new Attribute(TEXT_ATTRIBUTE, (List<String>) null));
        attributes.add(new Attribute(CLASS_ATTRIBUTE, classValues));

        final Instances data = new Instances("authorship", attributes, texts.size());
        data.setClassIndex(1);
        for (int i = 0; i < texts.size(); i++) {
            final double[] values = new double[2];
            values[0] = data.attribute(0).addStringValue(texts.get(i));
            values[1] = data.attribute(1).indexOfValue(String.valueOf(labels.get(i)));
            data.add(new DenseInstance(1.0, values));
        }
        return data;
    }
}
