package com.anirudhology.codeauthorship.data;

import org.slf4j.Logger;

/**
 * Optional side channel for reporting how far a long-running step has come.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (stage, processed) -> {
    };

    /**
     * @param stage     short name of the step, e.g. "read"
     * @param processed number of items handled so far
     */
    void onProgress(String stage, long processed);

    /**
     * @param logger logger to report to
     * @param every  report once every this many items
     * @return listener that logs at INFO
     */
    static ProgressListener logging(Logger logger, long every) {
        if (every <= 0) {
            throw new IllegalArgumentException("every must be positive, got: " + every);
        }
        return (stage, processed) -> {
            if (processed % every == 0) {
                logger.info("{}: {} processed", stage, processed);
            }
        };
    }
}
