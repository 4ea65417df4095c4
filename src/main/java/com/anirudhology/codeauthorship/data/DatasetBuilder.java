package com.anirudhology.codeauthorship.data;

import com.anirudhology.codeauthorship.tokenizer.AuthorUsage;
import com.anirudhology.codeauthorship.tokenizer.ReservedWords;
import com.anirudhology.codeauthorship.tokenizer.TokenFilter;
import com.anirudhology.codeauthorship.tokenizer.TokenFilterOptions;
import com.anirudhology.codeauthorship.types.Example;
import com.anirudhology.codeauthorship.types.Language;
import com.anirudhology.codeauthorship.types.TokenRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns the examples of one language into a {@link Dataset}.
 * <p>
 * For each example the token list is filtered, every retained value is
 * lowercased (case is ignored downstream) and the username and example id
 * are recorded. Usernames are then encoded densely in sorted order.
 */
public class DatasetBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetBuilder.class);

    private final Language language;
    private final TokenFilterOptions filterOptions;
    private final boolean exportTypes;

    public DatasetBuilder(Language language, TokenFilterOptions filterOptions, boolean exportTypes) {
        this.language = language;
        this.filterOptions = filterOptions;
        this.exportTypes = exportTypes;
    }

    /**
     * @param examples examples of this builder's language; empty-token examples are expected
     *                 to have been dropped at ingestion
     * @return the per-language dataset
     */
    public Dataset build(List<Example> examples) {
        // Author usage is scoped to the batch being built
        final AuthorUsage authorUsage = this.filterOptions.usesAuthorUsage() ? AuthorUsage.compute(examples) : null;
        final TokenFilter filter = new TokenFilter(this.filterOptions, ReservedWords.forLanguage(this.language), authorUsage);

        final List<List<String>> primary = new ArrayList<>(examples.size());
        final List<String> usernames = new ArrayList<>(examples.size());
        final List<String> exampleIds = new ArrayList<>(examples.size());
        final List<List<String>> seqTypes = this.exportTypes ? new ArrayList<>(examples.size()) : null;

        for (Example example : examples) {
            final List<TokenRecord> tokens = filter.apply(example.tokens());

            final List<String> values = new ArrayList<>(tokens.size());
            for (TokenRecord token : tokens) {
                values.add(token.val().toLowerCase(Locale.ROOT));
            }
            primary.add(values);
            usernames.add(example.username());
            exampleIds.add(example.exampleId());

            if (seqTypes != null) {
                final List<String> types = new ArrayList<>(tokens.size());
                for (TokenRecord token : tokens) {
                    types.add(token.type());
                }
                seqTypes.add(types);
            }
        }

        final Map<String, Integer> label2idx = buildLabelVocabulary(usernames);
        final List<Integer> labels = new ArrayList<>(usernames.size());
        for (String username : usernames) {
            labels.add(label2idx.get(username));
        }

        if (seqTypes != null) {
            LOG.info("TYPES [{}]: {}", this.language, countTypes(seqTypes));
        }

        return new Dataset(primary, exampleIds, labels, seqTypes, label2idx, this.language);
    }

    /**
     * Assigns each distinct username a dense 0-based index in sorted order
     *
     * @param usernames usernames in example order, duplicates allowed
     * @return username to index mapping
     */
    static Map<String, Integer> buildLabelVocabulary(List<String> usernames) {
        final SortedSet<String> sortedUsernames = new TreeSet<>(usernames);
        final Map<String, Integer> label2idx = new HashMap<>();
        int id = 0;
        for (String username : sortedUsernames) {
            label2idx.put(username, id);
            id++;
        }
        return label2idx;
    }

    private static Map<String, Integer> countTypes(List<List<String>> seqTypes) {
        final Map<String, Integer> counts = new TreeMap<>();
        for (List<String> types : seqTypes) {
            for (String type : types) {
                counts.merge(String.valueOf(type), 1, Integer::sum);
            }
        }
        return counts;
    }
}
