package org.imbalance.resampling;

import org.imbalance.exceptions.InsufficientSamplesException;
import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;
import org.imbalance.model.ResampledData;
import org.imbalance.utilities.InstancesConverter;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class of the resamplers that work on Weka {@link Instances}.
 * <p>
 * Every class is brought up to the size of the majority class; rows added by a
 * subclass come after the original rows, which keep their order.
 */
public abstract class InstancesResampler implements Resampler {

    private final String name;

    protected InstancesResampler(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public ResampledData resample(FeatureMatrix features, LabelVector labels) throws Exception {
        Instances data = InstancesConverter.toInstances(features, labels);
        Instances resampled = resampleInstances(data);
        return InstancesConverter.toResampledData(resampled, features);
    }

    /**
     * @param data converted copy of the input, class attribute set; may be read but not modified
     */
    protected abstract Instances resampleInstances(Instances data) throws Exception;

    protected static int[] classCounts(Instances data) {
        return data.attributeStats(data.classIndex()).nominalCounts;
    }

    protected static int majorityCount(int[] counts) {
        int max = 0;
        for (int count : counts) {
            max = Math.max(max, count);
        }
        return max;
    }

    protected static List<Integer> rowsOfClass(Instances data, int classIndex) {
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < data.numInstances(); i++) {
            if ((int) data.instance(i).classValue() == classIndex) {
                rows.add(i);
            }
        }
        return rows;
    }

    protected static List<Integer> allRows(Instances data) {
        List<Integer> rows = new ArrayList<>(data.numInstances());
        for (int i = 0; i < data.numInstances(); i++) {
            rows.add(i);
        }
        return rows;
    }

    protected static String classLabel(Instances data, int classIndex) {
        return data.classAttribute().value(classIndex);
    }

    /**
     * Neighbour based strategies need more rows in the class than neighbours to look for.
     */
    protected void requireNeighbours(Instances data, int classIndex, int count, int neighbours) {
        if (count <= neighbours) {
            throw new InsufficientSamplesException(classLabel(data, classIndex), count, neighbours + 1,
                    getName() + " with " + neighbours + " neighbours");
        }
    }
}
