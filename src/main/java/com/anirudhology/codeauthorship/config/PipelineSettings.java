package com.anirudhology.codeauthorship.config;

import com.anirudhology.codeauthorship.data.BalancerOptions;
import com.anirudhology.codeauthorship.tokenizer.TokenFilterOptions;
import com.anirudhology.codeauthorship.types.Language;
import com.typesafe.config.Config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Typed view of the "codeauthorship" configuration tree.
 *
 * @param inputs        JSONL input per language
 * @param filterOptions token vocabulary filter toggles
 * @param exportTypes   also keep the token type sequences
 * @param balancer      class balancing rules
 * @param maxFeatures   vocabulary size limit of the vectorizer, null for no limit
 * @param folds         number of cross-validation folds
 * @param shuffleFolds  shuffle each class before dealing it into folds
 * @param trees         number of trees of the baseline forest
 * @param seed          seed of the run, null until one is drawn
 * @param showProgress  report reading progress
 */
public record PipelineSettings(Map<Language, Path> inputs,
                               TokenFilterOptions filterOptions,
                               boolean exportTypes,
                               BalancerOptions balancer,
                               Integer maxFeatures,
                               int folds,
                               boolean shuffleFolds,
                               int trees,
                               Long seed,
                               boolean showProgress) {

    public static final String ROOT = "codeauthorship";

    public PipelineSettings {
        final Map<Language, Path> ordered = new EnumMap<>(Language.class);
        ordered.putAll(inputs);
        inputs = Collections.unmodifiableMap(ordered);
        if (maxFeatures != null && maxFeatures <= 0) {
            throw new IllegalArgumentException("max-features must be positive, got: " + maxFeatures);
        }
        if (folds < 2) {
            throw new IllegalArgumentException("folds must be at least 2, got: " + folds);
        }
        if (trees <= 0) {
            throw new IllegalArgumentException("trees must be positive, got: " + trees);
        }
    }

    /**
     * @param root full configuration holding a "codeauthorship" tree
     * @return settings read from that tree
     */
    public static PipelineSettings fromConfig(Config root) {
        final Config config = root.getConfig(ROOT);

        final Map<Language, Path> inputs = new EnumMap<>(Language.class);
        final Config input = config.getConfig("input");
        for (String tag : input.root().keySet()) {
            inputs.put(Language.fromTag(tag), Paths.get(expandHome(input.getString(tag))));
        }

        final TokenFilterOptions filterOptions = new TokenFilterOptions(
                TokenFilterOptions.parseTypes(config.getString("filter.include-type")),
                TokenFilterOptions.parseTypes(config.getString("filter.exclude-type")),
                config.getBoolean("filter.reserved"),
                config.getBoolean("filter.notreserved"),
                optionalInt(config, "filter.author-usage"));

        final BalancerOptions balancer = new BalancerOptions(
                config.getInt("balance.files-per-author"),
                config.getBoolean("balance.exact"),
                config.getBoolean("balance.multilang"),
                optionalInt(config, "balance.max-classes"));

        return new PipelineSettings(
                inputs,
                filterOptions,
                config.getBoolean("filter.extra-type"),
                balancer,
                optionalInt(config, "features.max-features"),
                config.getInt("evaluation.folds"),
                config.getBoolean("evaluation.shuffle-folds"),
                config.getInt("evaluation.trees"),
                config.hasPath("seed") ? config.getLong("seed") : null,
                config.getBoolean("show-progress"));
    }

    public PipelineSettings withSeed(long newSeed) {
        return new PipelineSettings(this.inputs, this.filterOptions, this.exportTypes, this.balancer,
                this.maxFeatures, this.folds, this.shuffleFolds, this.trees, newSeed, this.showProgress);
    }

    private static Integer optionalInt(Config config, String path) {
        return config.hasPath(path) ? config.getInt(path) : null;
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }
}
