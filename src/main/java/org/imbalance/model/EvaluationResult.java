package org.imbalance.model;

import lombok.Getter;

import java.util.List;
import java.util.Locale;

/**
 * Scores of one (strategy, label) iteration. Immutable once built.
 */
@Getter
public class EvaluationResult {

    private final String strategyName;
    private final String labelName;
    private final String classifierName;
    private final double meanAccuracy;
    private final double accuracyStdDev;
    private final List<Double> foldAccuracies;
    private final LabelVector predictions;
    private final int resampledRows;

    public EvaluationResult(String strategyName, String labelName, String classifierName,
                            double meanAccuracy, double accuracyStdDev, List<Double> foldAccuracies,
                            LabelVector predictions, int resampledRows) {
        this.strategyName = strategyName;
        this.labelName = labelName;
        this.classifierName = classifierName;
        this.meanAccuracy = meanAccuracy;
        this.accuracyStdDev = accuracyStdDev;
        this.foldAccuracies = List.copyOf(foldAccuracies);
        this.predictions = predictions;
        this.resampledRows = resampledRows;
    }

    public ScoreKey getKey() {
        return new ScoreKey(strategyName, labelName);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s - %s - %s Accuracy: %.2f%% (+/- %.2f)",
                strategyName, labelName, classifierName, meanAccuracy * 100, accuracyStdDev * 100);
    }
}
