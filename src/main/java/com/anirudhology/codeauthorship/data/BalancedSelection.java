package com.anirudhology.codeauthorship.data;

import com.anirudhology.codeauthorship.types.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Final example set handed to vectorization, in selection order.
 *
 * @param tokens               token value sequence of every selected example
 * @param labels               master label of every selected example
 * @param languages            language of every selected example
 * @param eligibleClasses      number of eligible classes found before any downsampling
 * @param languageDistribution how many retained classes drew their examples from each language combination
 */
public record BalancedSelection(List<List<String>> tokens,
                                List<Integer> labels,
                                List<Language> languages,
                                int eligibleClasses,
                                Map<List<Language>, Integer> languageDistribution) {

    /**
     * One row of the vectorization boundary
     *
     * @param text     tokens joined with single spaces
     * @param label    master label
     * @param language language of the source file
     */
    public record SelectedExample(String text, int label, Language language) {
    }

    public int size() {
        return this.labels.size();
    }

    /**
     * @return every example's tokens joined with single spaces
     */
    public List<String> texts() {
        final List<String> texts = new ArrayList<>(this.tokens.size());
        for (List<String> sequence : this.tokens) {
            texts.add(String.join(" ", sequence));
        }
        return texts;
    }

    public List<SelectedExample> examples() {
        final List<String> texts = texts();
        final List<SelectedExample> examples = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            examples.add(new SelectedExample(texts.get(i), this.labels.get(i), this.languages.get(i)));
        }
        return examples;
    }
}
