package com.anirudhology.codeauthorship.data;

/**
 * Selection rules of the {@link ClassBalancer}.
 *
 * @param filesPerAuthor number of examples kept for every retained class
 * @param exact          require a class to have exactly filesPerAuthor examples instead of at least that many
 * @param multilang      require a class's examples to span more than one language
 * @param maxClasses     keep at most this many eligible classes, null to keep all
 */
public record BalancerOptions(int filesPerAuthor, boolean exact, boolean multilang, Integer maxClasses) {

    public static final int DEFAULT_FILES_PER_AUTHOR = 9;

    public BalancerOptions {
        if (filesPerAuthor <= 0) {
            throw new IllegalArgumentException("filesPerAuthor must be positive, got: " + filesPerAuthor);
        }
        if (maxClasses != null && maxClasses <= 0) {
            throw new IllegalArgumentException("maxClasses must be positive, got: " + maxClasses);
        }
    }

    public static BalancerOptions defaults() {
        return new BalancerOptions(DEFAULT_FILES_PER_AUTHOR, false, false, null);
    }
}
