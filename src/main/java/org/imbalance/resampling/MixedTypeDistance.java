package org.imbalance.resampling;

import weka.core.EuclideanDistance;
import weka.core.Instances;

import java.util.Set;

/**
 * Euclidean distance on continuous attributes, a fixed penalty for every
 * categorical attribute whose values differ.
 */
class MixedTypeDistance extends EuclideanDistance {

    private static final long serialVersionUID = 1L;

    private final Set<Integer> categorical;
    private final double penalty;

    MixedTypeDistance(Instances data, Set<Integer> categorical, double penalty) {
        super(data);
        setDontNormalize(true);
        this.categorical = Set.copyOf(categorical);
        this.penalty = penalty;
    }

    @Override
    protected double difference(int index, double val1, double val2) {
        if (categorical.contains(index)) {
            return val1 == val2 ? 0.0 : penalty;
        }
        return super.difference(index, val1, val2);
    }
}
