package com.anirudhology.codeauthorship.data;

import com.anirudhology.codeauthorship.types.Language;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-language dataset produced by {@link DatasetBuilder}.
 * <p>
 * Layout:
 * - primary data: one lowercased token value sequence per example
 * - secondary data: per-example fields parallel to the primary data
 * (example ids, integer labels, language tags and optionally token types)
 * - metadata: the label vocabulary and the language of the dataset
 * <p>
 * Every secondary field has exactly as many entries as the primary data.
 * Nothing changes after construction except labels and label vocabulary,
 * which {@link DatasetConsolidator} replaces together.
 */
public class Dataset {

    private final List<List<String>> primary;

    private final List<String> exampleIds;
    private List<Integer> labels;
    private final List<Language> languages;

    // Null unless token type export was enabled
    private final List<List<String>> seqTypes;

    private Map<String, Integer> label2idx;
    private final Language language;

    public Dataset(List<List<String>> primary,
                   List<String> exampleIds,
                   List<Integer> labels,
                   List<List<String>> seqTypes,
                   Map<String, Integer> label2idx,
                   Language language) {
        checkAligned("example_ids", primary.size(), exampleIds.size());
        checkAligned("labels", primary.size(), labels.size());
        if (seqTypes != null) {
            checkAligned("seq_types", primary.size(), seqTypes.size());
        }
        this.primary = List.copyOf(primary);
        this.exampleIds = List.copyOf(exampleIds);
        this.labels = List.copyOf(labels);
        this.languages = Collections.nCopies(primary.size(), language);
        this.seqTypes = seqTypes == null ? null : List.copyOf(seqTypes);
        this.label2idx = Map.copyOf(label2idx);
        this.language = language;
    }

    /**
     * Replaces the label vocabulary and every label at once
     *
     * @param newLabels    labels expressed in the new vocabulary
     * @param newLabel2idx new username to index mapping
     */
    void relabel(List<Integer> newLabels, Map<String, Integer> newLabel2idx) {
        checkAligned("labels", this.primary.size(), newLabels.size());
        this.labels = List.copyOf(newLabels);
        this.label2idx = Map.copyOf(newLabel2idx);
    }

    public List<List<String>> primary() {
        return this.primary;
    }

    public List<String> exampleIds() {
        return this.exampleIds;
    }

    public List<Integer> labels() {
        return this.labels;
    }

    public List<Language> languages() {
        return this.languages;
    }

    public boolean hasSeqTypes() {
        return this.seqTypes != null;
    }

    /**
     * @return token type sequences parallel to the primary data
     * @throws IllegalStateException if the dataset was built without type export
     */
    public List<List<String>> seqTypes() {
        if (this.seqTypes == null) {
            throw new IllegalStateException("Dataset was built without token type export");
        }
        return this.seqTypes;
    }

    public Map<String, Integer> label2idx() {
        return this.label2idx;
    }

    public Language language() {
        return this.language;
    }

    public int size() {
        return this.primary.size();
    }

    public int numberOfClasses() {
        return this.label2idx.size();
    }

    /**
     * @return number of distinct token values across the primary data
     */
    public int vocabularySize() {
        final Set<String> vocabulary = new HashSet<>();
        for (List<String> sequence : this.primary) {
            vocabulary.addAll(sequence);
        }
        return vocabulary.size();
    }

    private static void checkAligned(String field, int expected, int actual) {
        if (expected != actual) {
            throw new IllegalArgumentException(
                    "Secondary field '" + field + "' has " + actual + " entries, primary data has " + expected);
        }
    }
}
