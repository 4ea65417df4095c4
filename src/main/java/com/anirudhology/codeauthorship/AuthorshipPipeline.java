package com.anirudhology.codeauthorship;

import com.anirudhology.codeauthorship.config.PipelineSettings;
import com.anirudhology.codeauthorship.data.BalancedSelection;
import com.anirudhology.codeauthorship.data.ClassBalancer;
import com.anirudhology.codeauthorship.data.Dataset;
import com.anirudhology.codeauthorship.data.DatasetReader;
import com.anirudhology.codeauthorship.data.ExampleReader;
import com.anirudhology.codeauthorship.data.ProgressListener;
import com.anirudhology.codeauthorship.training.AuthorshipClassifier;
import com.anirudhology.codeauthorship.training.CrossValidator;
import com.anirudhology.codeauthorship.training.ExperimentResult;
import com.anirudhology.codeauthorship.training.RandomForestAuthorshipClassifier;
import com.anirudhology.codeauthorship.training.StratifiedKFold;
import com.anirudhology.codeauthorship.training.TextVectorizer;
import com.anirudhology.codeauthorship.training.TfidfVectorizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.core.Instances;

import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Runs the whole pipeline for one seed:
 * read -> filter and build per language -> consolidate -> balance -> vectorize -> cross-validate.
 * <p>
 * One {@link Random} is created from the seed and shared by the pool shuffle,
 * the class-order shuffle and the fold splitter, in that order.
 */
public class AuthorshipPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AuthorshipPipeline.class);

    private static final long PROGRESS_EVERY = 10_000L;

    /**
     * @param selection  examples that were vectorized
     * @param experiment cross-validation scores
     */
    public record Result(BalancedSelection selection, ExperimentResult experiment) {
    }

    private final PipelineSettings settings;
    private final TextVectorizer vectorizer;
    private final Supplier<AuthorshipClassifier> classifierFactory;

    public AuthorshipPipeline(PipelineSettings settings) {
        this(settings,
                new TfidfVectorizer(settings.maxFeatures()),
                () -> new RandomForestAuthorshipClassifier(settings.trees(), 0));
    }

    public AuthorshipPipeline(PipelineSettings settings,
                              TextVectorizer vectorizer,
                              Supplier<AuthorshipClassifier> classifierFactory) {
        if (settings.seed() == null) {
            throw new IllegalArgumentException("A seed is required to run the pipeline");
        }
        this.settings = settings;
        this.vectorizer = vectorizer;
        this.classifierFactory = classifierFactory;
    }

    public Result run() throws Exception {
        final Random random = new Random(this.settings.seed());
        final BalancedSelection selection = select(random);

        LOG.info("joining strings");
        final List<String> texts = selection.texts();
        final Instances vectors = this.vectorizer.vectorize(texts, selection.labels());

        final StratifiedKFold splitter = new StratifiedKFold(this.settings.folds(), this.settings.shuffleFolds(), random);
        final ExperimentResult experiment = new CrossValidator(this.classifierFactory, splitter).run(vectors, selection.labels());
        return new Result(selection, experiment);
    }

    /**
     * Stops after balancing
     *
     * @return the balanced selection this seed produces
     */
    public BalancedSelection select() {
        return select(new Random(this.settings.seed()));
    }

    private BalancedSelection select(Random random) {
        final ProgressListener progress = this.settings.showProgress()
                ? ProgressListener.logging(LOG, PROGRESS_EVERY)
                : ProgressListener.NONE;
        final ExampleReader exampleReader = new ExampleReader(new ObjectMapper(), progress);
        final DatasetReader datasetReader = new DatasetReader(exampleReader, this.settings.filterOptions(), this.settings.exportTypes());
        final List<Dataset> datasets = datasetReader.read(this.settings.inputs());

        LOG.info("balancing data");
        return new ClassBalancer(this.settings.balancer(), random).balance(datasets);
    }
}
