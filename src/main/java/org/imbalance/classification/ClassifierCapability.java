package org.imbalance.classification;

import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;

/**
 * The classifier the evaluation loop trains and scores. Implementations must not
 * modify the matrices and vectors they receive.
 */
public interface ClassifierCapability {

    String getName();

    void fit(FeatureMatrix features, LabelVector labels) throws Exception;

    /**
     * Predicts with the model built by the last {@link #fit} call.
     */
    LabelVector predict(FeatureMatrix features) throws Exception;

    /**
     * Out-of-fold accuracy and predictions over a stratified k-fold partition of the given data.
     */
    CrossValidationResult crossValidate(FeatureMatrix features, LabelVector labels) throws Exception;
}
