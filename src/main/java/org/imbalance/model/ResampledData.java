package org.imbalance.model;

import java.util.Objects;

/**
 * Output of a resampler: the rebalanced feature matrix and its aligned labels.
 */
public record ResampledData(FeatureMatrix features, LabelVector labels) {

    public ResampledData {
        Objects.requireNonNull(features, "features");
        Objects.requireNonNull(labels, "labels");
        if (features.rowCount() != labels.size()) {
            throw new IllegalStateException("Resampled features have " + features.rowCount()
                    + " rows but labels have " + labels.size());
        }
    }

    public int size() {
        return labels.size();
    }

    public String shape() {
        return "x " + features.shape() + ",  y (" + labels.size() + ",)";
    }
}
