package org.imbalance.classification;

import lombok.Getter;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.imbalance.model.LabelVector;

import java.util.List;

@Getter
public class CrossValidationResult {

    private final List<Double> foldAccuracies;
    private final double meanAccuracy;
    private final double accuracyStdDev; // population standard deviation over the folds
    private final LabelVector predictions;

    public CrossValidationResult(List<Double> foldAccuracies, LabelVector predictions) {
        if (foldAccuracies.isEmpty()) {
            throw new IllegalArgumentException("No fold accuracy");
        }
        this.foldAccuracies = List.copyOf(foldAccuracies);
        double[] values = this.foldAccuracies.stream().mapToDouble(Double::doubleValue).toArray();
        this.meanAccuracy = new Mean().evaluate(values);
        this.accuracyStdDev = new StandardDeviation(false).evaluate(values);
        this.predictions = predictions;
    }
}
