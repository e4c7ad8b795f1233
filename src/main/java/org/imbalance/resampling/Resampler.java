package org.imbalance.resampling;

import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;
import org.imbalance.model.ResampledData;

/**
 * A class-balancing strategy.
 * <p>
 * Implementations return a new matrix and label vector of equal length and never
 * modify the ones they receive.
 */
public interface Resampler {

    /**
     * Display name, also the strategy part of the score ledger key.
     */
    String getName();

    ResampledData resample(FeatureMatrix features, LabelVector labels) throws Exception;
}
