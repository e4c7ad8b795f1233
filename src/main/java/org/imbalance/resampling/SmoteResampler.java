package org.imbalance.resampling;

import org.imbalance.logging.Printer;
import weka.core.Instances;
import weka.filters.Filter;
import weka.filters.supervised.instance.SMOTE;

/**
 * Weka's SMOTE filter, run once per minority class with the percentage that
 * brings the class to the majority count.
 */
public class SmoteResampler extends InstancesResampler {

    private final int neighbours;
    private final int seed;

    public SmoteResampler(int neighbours, int seed) {
        super("SMOTE");
        this.neighbours = neighbours;
        this.seed = seed;
    }

    @Override
    protected Instances resampleInstances(Instances data) throws Exception {
        int[] counts = classCounts(data);
        int target = majorityCount(counts);
        Instances current = data;

        for (int c = 0; c < counts.length; c++) {
            if (counts[c] == 0 || counts[c] >= target) {
                continue;
            }
            requireNeighbours(data, c, counts[c], neighbours);

            SMOTE smote = new SMOTE();
            smote.setClassValue(String.valueOf(c + 1)); // 1-based, 0 would mean "auto-detect minority"
            smote.setPercentage(100.0 * (target - counts[c]) / counts[c]);
            smote.setNearestNeighbors(neighbours);
            smote.setRandomSeed(seed);
            smote.setInputFormat(current);
            current = Filter.useFilter(current, smote);

            Printer.printlnGreen(getName() + ": class '" + classLabel(data, c) + "' " + counts[c] + " -> "
                    + classCounts(current)[c]);
        }
        return current;
    }
}
