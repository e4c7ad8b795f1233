package org.imbalance.resampling;

import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;
import org.imbalance.model.ResampledData;

/**
 * Baseline without resampling: hands back the very same matrix and labels.
 */
public class OriginalResampler implements Resampler {

    public static final String NAME = "Original";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ResampledData resample(FeatureMatrix features, LabelVector labels) {
        return new ResampledData(features, labels);
    }
}
