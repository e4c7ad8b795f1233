package org.imbalance.resampling;

import org.imbalance.logging.Printer;
import weka.core.DenseInstance;
import weka.core.DistanceFunction;
import weka.core.EuclideanDistance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.List;
import java.util.Random;

/**
 * Common frame of the SMOTE family: every minority class gets
 * {@code majority - count} synthetic rows from {@link #generate}, built on the
 * original rows only.
 */
public abstract class AbstractSmoteResampler extends InstancesResampler {

    protected final int neighbours;
    protected final long seed;

    protected AbstractSmoteResampler(String name, int neighbours, long seed) {
        super(name);
        this.neighbours = neighbours;
        this.seed = seed;
    }

    @Override
    protected Instances resampleInstances(Instances data) throws Exception {
        Random random = new Random(seed);
        Instances resampled = new Instances(data);
        int[] counts = classCounts(data);
        int target = majorityCount(counts);

        for (int c = 0; c < counts.length; c++) {
            if (counts[c] == 0 || counts[c] >= target) {
                continue;
            }
            requireNeighbours(data, c, counts[c], neighbours);
            List<Instance> synthetic = generate(data, c, target - counts[c], random);
            for (Instance instance : synthetic) {
                resampled.add(instance);
            }
            Printer.printlnGreen(getName() + ": class '" + classLabel(data, c) + "' " + counts[c] + " -> "
                    + (counts[c] + synthetic.size()));
        }
        return resampled;
    }

    /**
     * Builds {@code amount} synthetic rows of class {@code classIndex}.
     */
    protected abstract List<Instance> generate(Instances data, int classIndex, int amount, Random random)
            throws Exception;

    /**
     * Plain Euclidean distance; features are already scaled by the preprocessing.
     */
    protected DistanceFunction distanceFunction(Instances data) {
        EuclideanDistance distance = new EuclideanDistance(data);
        distance.setDontNormalize(true);
        return distance;
    }

    /**
     * {@code base + gap * (neighbour - base)} on every feature, class of {@code base}.
     * A negative gap moves away from the neighbour.
     */
    protected static Instance interpolate(Instances data, Instance base, Instance neighbour, double gap) {
        double[] values = new double[data.numAttributes()];
        for (int a = 0; a < values.length; a++) {
            if (a == data.classIndex()) {
                values[a] = base.classValue();
            } else {
                values[a] = base.value(a) + gap * (neighbour.value(a) - base.value(a));
            }
        }
        Instance synthetic = new DenseInstance(1.0, values);
        synthetic.setDataset(data);
        return synthetic;
    }

    /**
     * Splits {@code total} proportionally to {@code weights}, largest remainders first, so the parts sum to {@code total}.
     */
    static int[] allocate(double[] weights, int total) {
        double sum = 0;
        for (double weight : weights) {
            sum += weight;
        }
        int[] parts = new int[weights.length];
        if (sum <= 0 || weights.length == 0) {
            return parts;
        }
        double[] remainders = new double[weights.length];
        int assigned = 0;
        for (int i = 0; i < weights.length; i++) {
            double exact = total * weights[i] / sum;
            parts[i] = (int) Math.floor(exact);
            remainders[i] = exact - parts[i];
            assigned += parts[i];
        }
        while (assigned < total) {
            int best = 0;
            for (int i = 1; i < remainders.length; i++) {
                if (remainders[i] > remainders[best]) {
                    best = i;
                }
            }
            parts[best]++;
            remainders[best] = -1.0;
            assigned++;
        }
        return parts;
    }
}
