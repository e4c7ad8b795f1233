package org.imbalance.resampling;

import org.imbalance.logging.Printer;
import weka.core.Instances;

import java.util.List;
import java.util.Random;

/**
 * Duplicates randomly chosen rows (with replacement) of every minority class.
 */
public class RandomOverSampler extends InstancesResampler {

    private final long seed;

    public RandomOverSampler(long seed) {
        super("RandomOverSampler");
        this.seed = seed;
    }

    @Override
    protected Instances resampleInstances(Instances data) {
        Random random = new Random(seed);
        Instances resampled = new Instances(data);
        int[] counts = classCounts(data);
        int target = majorityCount(counts);

        for (int c = 0; c < counts.length; c++) {
            if (counts[c] == 0 || counts[c] >= target) {
                continue;
            }
            List<Integer> rows = rowsOfClass(data, c);
            for (int i = counts[c]; i < target; i++) {
                resampled.add(data.instance(rows.get(random.nextInt(rows.size()))));
            }
            Printer.printlnGreen(getName() + ": class '" + classLabel(data, c) + "' " + counts[c] + " -> " + target);
        }
        return resampled;
    }
}
