package com.anirudhology.codeauthorship.training;

import java.util.List;

/**
 * Outcome of a cross-validated run, one entry per fold.
 */
public record ExperimentResult(List<FoldResult> folds) {

    public ExperimentResult {
        folds = List.copyOf(folds);
    }

    public double averageAccuracy() {
        return this.folds.stream().mapToDouble(FoldResult::accuracy).average().orElse(Double.NaN);
    }

    public double averageF1() {
        return this.folds.stream().mapToDouble(FoldResult::averageF1).average().orElse(Double.NaN);
    }
}
