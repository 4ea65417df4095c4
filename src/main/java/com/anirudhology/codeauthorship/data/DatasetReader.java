package com.anirudhology.codeauthorship.data;

import com.anirudhology.codeauthorship.tokenizer.TokenFilterOptions;
import com.anirudhology.codeauthorship.types.Example;
import com.anirudhology.codeauthorship.types.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads every configured per-language input, builds one dataset per language
 * and aligns their label spaces.
 */
public class DatasetReader {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetReader.class);

    private final ExampleReader exampleReader;
    private final TokenFilterOptions filterOptions;
    private final boolean exportTypes;
    private final DatasetConsolidator consolidator;

    public DatasetReader(ExampleReader exampleReader, TokenFilterOptions filterOptions, boolean exportTypes) {
        this.exampleReader = exampleReader;
        this.filterOptions = filterOptions;
        this.exportTypes = exportTypes;
        this.consolidator = new DatasetConsolidator();
    }

    /**
     * @param inputs JSONL input per language; languages without an entry are skipped
     * @return consolidated datasets in language declaration order
     */
    public List<Dataset> read(Map<Language, Path> inputs) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input path is required");
        }
        // EnumMap iterates in declaration order: python, c, cpp
        final Map<Language, Path> ordered = new EnumMap<>(inputs);

        final List<Dataset> datasets = new ArrayList<>(ordered.size());
        for (Map.Entry<Language, Path> input : ordered.entrySet()) {
            final List<Example> examples = this.exampleReader.read(input.getValue());
            final Dataset dataset = new DatasetBuilder(input.getKey(), this.filterOptions, this.exportTypes).build(examples);
            LOG.info("[{}] dataset-size={} vocab-size={} classes={}",
                    dataset.language(), dataset.size(), dataset.vocabularySize(), dataset.numberOfClasses());
            datasets.add(dataset);
        }

        this.consolidator.consolidate(datasets);
        return datasets;
    }
}
