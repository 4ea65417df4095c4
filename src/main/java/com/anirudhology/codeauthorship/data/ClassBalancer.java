package com.anirudhology.codeauthorship.data;

import com.anirudhology.codeauthorship.types.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * Selects the same number of examples for every eligible author.
 * <p>
 * Steps:
 * 1. Pool the examples of all datasets (text, label and language stay aligned)
 * 2. Shuffle the pool with one permutation applied to all three
 * 3. Shuffle the order in which classes are visited
 * 4. For each eligible class take its first filesPerAuthor pool positions
 * 5. Optionally keep only the first maxClasses eligible classes
 * <p>
 * Taking the first positions of a shuffled pool amounts to drawing a uniform
 * sample without replacement from the class. Both shuffles draw from the
 * supplied {@link Random}, so a fixed seed reproduces the selection exactly.
 */
public class ClassBalancer {

    private static final Logger LOG = LoggerFactory.getLogger(ClassBalancer.class);

    private final BalancerOptions options;
    private final Random random;

    public ClassBalancer(BalancerOptions options, Random random) {
        this.options = options;
        this.random = random;
    }

    /**
     * @param datasets consolidated per-language datasets sharing one label vocabulary
     * @return balanced selection in selection order
     */
    public BalancedSelection balance(List<Dataset> datasets) {
        final int filesPerAuthor = this.options.filesPerAuthor();

        // 1. Accumulate all data
        final List<List<String>> allTokens = new ArrayList<>();
        final List<Integer> allLabels = new ArrayList<>();
        final List<Language> allLanguages = new ArrayList<>();
        for (Dataset dataset : datasets) {
            allTokens.addAll(dataset.primary());
            allLabels.addAll(dataset.labels());
            allLanguages.addAll(dataset.languages());
        }

        // 2. Shuffle the pool with a single permutation
        final List<Integer> permutation = new ArrayList<>(allLabels.size());
        for (int i = 0; i < allLabels.size(); i++) {
            permutation.add(i);
        }
        Collections.shuffle(permutation, this.random);
        final List<List<String>> tokens = permute(allTokens, permutation);
        final List<Integer> labels = permute(allLabels, permutation);
        final List<Language> languages = permute(allLanguages, permutation);

        // Pool positions of every class, in shuffled order
        final Map<Integer, List<Integer>> positionsByLabel = new HashMap<>();
        for (int position = 0; position < labels.size(); position++) {
            positionsByLabel.computeIfAbsent(labels.get(position), k -> new ArrayList<>()).add(position);
        }

        // 3. Visit classes in random order. Sorting first keeps the outcome independent of hash order
        final List<Integer> labelOrder = new ArrayList<>(new TreeSet<>(labels));
        Collections.shuffle(labelOrder, this.random);

        // 4. Record the positions to keep
        final List<Integer> indexToKeep = new ArrayList<>();
        final List<List<Language>> perClassLanguages = new ArrayList<>();
        int found = 0;
        for (Integer label : labelOrder) {
            final List<Integer> positions = positionsByLabel.get(label);
            if (!isEligible(positions, languages)) {
                continue;
            }
            final List<Integer> taken = positions.subList(0, filesPerAuthor);
            indexToKeep.addAll(taken);
            found++;
            perClassLanguages.add(distinctLanguages(taken, languages));
        }

        if (indexToKeep.size() != filesPerAuthor * found) {
            throw new IllegalStateException("Selected " + indexToKeep.size() + " examples for " + found
                    + " classes of " + filesPerAuthor + " files each");
        }
        LOG.info("found {} eligible classes", found);

        // 5. Optionally downsample the eligible classes
        List<Integer> kept = indexToKeep;
        List<List<Language>> keptLanguages = perClassLanguages;
        if (this.options.maxClasses() != null) {
            final int maxClasses = this.options.maxClasses();
            kept = indexToKeep.subList(0, Math.min(indexToKeep.size(), maxClasses * filesPerAuthor));
            keptLanguages = perClassLanguages.subList(0, Math.min(perClassLanguages.size(), maxClasses));
            LOG.info("downsampled to {} classes", kept.size() / filesPerAuthor);
        }

        final Map<List<Language>, Integer> languageDistribution = new LinkedHashMap<>();
        for (List<Language> combination : keptLanguages) {
            languageDistribution.merge(combination, 1, Integer::sum);
        }
        LOG.info("language-distribution={}", languageDistribution);

        return new BalancedSelection(
                List.copyOf(permute(tokens, kept)),
                List.copyOf(permute(labels, kept)),
                List.copyOf(permute(languages, kept)),
                found,
                Collections.unmodifiableMap(languageDistribution));
    }

    private boolean isEligible(List<Integer> positions, List<Language> languages) {
        final int count = positions.size();
        if (this.options.exact() ? count != this.options.filesPerAuthor() : count < this.options.filesPerAuthor()) {
            return false;
        }
        // A class written in a single language cannot test cross-language attribution
        return !this.options.multilang() || distinctLanguages(positions, languages).size() > 1;
    }

    // Distinct languages of the given positions, sorted by tag
    private static List<Language> distinctLanguages(List<Integer> positions, List<Language> languages) {
        final Set<Language> distinct = EnumSet.noneOf(Language.class);
        for (Integer position : positions) {
            distinct.add(languages.get(position));
        }
        final List<Language> sorted = new ArrayList<>(distinct);
        sorted.sort(Comparator.comparing(Language::tag));
        return List.copyOf(sorted);
    }

    private static <T> List<T> permute(List<T> values, List<Integer> index) {
        final List<T> permuted = new ArrayList<>(index.size());
        for (Integer i : index) {
            permuted.add(values.get(i));
        }
        return permuted;
    }
}
