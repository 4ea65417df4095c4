package com.anirudhology.codeauthorship;

import com.anirudhology.codeauthorship.config.ConfigLoader;
import com.anirudhology.codeauthorship.config.PipelineSettings;
import com.anirudhology.codeauthorship.types.Language;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Command line entry point. Every option overrides the matching key of the
 * loaded configuration; anything not given on the command line comes from
 * the configuration file or the defaults.
 */
@Command(
        name = "codeauthorship",
        mixinStandardHelpOptions = true,
        version = "codeauthorship 1.0",
        description = "Builds a balanced multi-language authorship dataset and cross-validates a baseline classifier."
)
public class Runner implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(Runner.class);

    // Upper bound (exclusive) of a drawn seed
    static final long MAX_SEED = 10_000_000L;

    @Option(names = {"-c", "--config"}, description = "Path to a configuration file (default: codeauthorship.conf).")
    File configFile;

    @Option(names = "--path-py", description = "Python token file (JSONL).")
    String pathPy;

    @Option(names = "--path-c", description = "C token file (JSONL).")
    String pathC;

    @Option(names = "--path-cpp", description = "C++ token file (JSONL).")
    String pathCpp;

    @Option(names = "--include-type", description = "Comma separated token types to keep.")
    String includeType;

    @Option(names = "--exclude-type", description = "Comma separated token types to drop.")
    String excludeType;

    @Option(names = "--reserved", description = "Keep only reserved words.")
    Boolean reserved;

    @Option(names = "--notreserved", description = "Keep only tokens that are not reserved words.")
    Boolean notReserved;

    @Option(names = "--author-usage", description = "Keep only tokens used by at least this many authors.")
    Integer authorUsage;

    @Option(names = "--extra-type", description = "Also export token type sequences.")
    Boolean extraType;

    @Option(names = "--files-per-author", description = "Examples kept per author.")
    Integer filesPerAuthor;

    @Option(names = "--exact", description = "Only keep authors with exactly files-per-author examples.")
    Boolean exact;

    @Option(names = "--multilang", description = "Only keep authors whose examples span several languages.")
    Boolean multilang;

    @Option(names = "--max-classes", description = "Keep at most this many authors.")
    Integer maxClasses;

    @Option(names = "--max-features", description = "Vocabulary size of the TF-IDF vectorizer.")
    Integer maxFeatures;

    @Option(names = "--folds", description = "Number of cross-validation folds.")
    Integer folds;

    @Option(names = "--seed", description = "Random seed; drawn at random when not given.")
    Long seed;

    @Option(names = "--show-progress", description = "Report reading progress.")
    Boolean showProgress;

    public static void main(String[] args) {
        final int exitCode = new CommandLine(new Runner()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        final PipelineSettings settings;
        try {
            settings = resolveSettings(ConfigLoader.load(this.configFile));
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
        if (settings.inputs().isEmpty()) {
            LOG.error("Invalid configuration: no input file given, use --path-py, --path-c or --path-cpp");
            return 1;
        }
        LOG.info("settings={}", settings);

        try {
            new AuthorshipPipeline(settings).run();
        } catch (UncheckedIOException e) {
            LOG.error("Failed to read input: {}", e.getMessage());
            return 1;
        }
        return 0;
    }

    /**
     * Applies the command line overrides and fills in a seed when none is configured
     */
    PipelineSettings resolveSettings(Config loaded) {
        final Config config = ConfigFactory.parseMap(overrides()).withFallback(loaded);
        final PipelineSettings settings = PipelineSettings.fromConfig(config);
        if (settings.seed() != null) {
            return settings;
        }
        final long drawn = ThreadLocalRandom.current().nextLong(MAX_SEED);
        LOG.info("No seed configured, using seed={}", drawn);
        return settings.withSeed(drawn);
    }

    private Map<String, Object> overrides() {
        final String prefix = PipelineSettings.ROOT + ".";
        final Map<String, Object> overrides = new HashMap<>();
        put(overrides, prefix + "input." + Language.PYTHON.tag(), this.pathPy);
        put(overrides, prefix + "input." + Language.C.tag(), this.pathC);
        put(overrides, prefix + "input." + Language.CPP.tag(), this.pathCpp);
        put(overrides, prefix + "filter.include-type", this.includeType);
        put(overrides, prefix + "filter.exclude-type", this.excludeType);
        put(overrides, prefix + "filter.reserved", this.reserved);
        put(overrides, prefix + "filter.notreserved", this.notReserved);
        put(overrides, prefix + "filter.author-usage", this.authorUsage);
        put(overrides, prefix + "filter.extra-type", this.extraType);
        put(overrides, prefix + "balance.files-per-author", this.filesPerAuthor);
        put(overrides, prefix + "balance.exact", this.exact);
        put(overrides, prefix + "balance.multilang", this.multilang);
        put(overrides, prefix + "balance.max-classes", this.maxClasses);
        put(overrides, prefix + "features.max-features", this.maxFeatures);
        put(overrides, prefix + "evaluation.folds", this.folds);
        put(overrides, prefix + "seed", this.seed);
        put(overrides, prefix + "show-progress", this.showProgress);
        return overrides;
    }

    private static void put(Map<String, Object> overrides, String path, Object value) {
        if (value != null) {
            overrides.put(path, value);
        }
    }
}
