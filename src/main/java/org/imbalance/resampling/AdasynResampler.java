package org.imbalance.resampling;

import org.imbalance.exceptions.SamplingException;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Adaptive synthetic sampling: rows whose neighbourhood is dominated by other
 * classes get more synthetic neighbours than rows deep inside their own class.
 */
public class AdasynResampler extends AbstractSmoteResampler {

    public AdasynResampler(int neighbours, long seed) {
        super("ADASYN", neighbours, seed);
    }

    @Override
    protected List<Instance> generate(Instances data, int classIndex, int amount, Random random) {
        NeighbourSearch search = new NeighbourSearch(data, distanceFunction(data));
        List<Integer> all = allRows(data);
        List<Integer> minority = rowsOfClass(data, classIndex);

        double[] hardness = new double[minority.size()];
        for (int i = 0; i < minority.size(); i++) {
            int row = minority.get(i);
            int[] nn = search.nearest(row, all, neighbours);
            hardness[i] = (double) search.countForeign(row, nn) / nn.length;
        }

        int[] perRow = allocate(hardness, amount);
        if (amount > 0 && sum(perRow) == 0) {
            throw new SamplingException("ADASYN: no row of class '" + classLabel(data, classIndex)
                    + "' has a neighbour of another class, nothing to weight synthetic rows by");
        }

        List<Instance> synthetic = new ArrayList<>(amount);
        for (int i = 0; i < minority.size(); i++) {
            if (perRow[i] == 0) {
                continue;
            }
            Instance base = data.instance(minority.get(i));
            int[] sameClass = search.nearest(minority.get(i), minority, neighbours);
            for (int j = 0; j < perRow[i]; j++) {
                Instance neighbour = data.instance(sameClass[random.nextInt(sameClass.length)]);
                synthetic.add(interpolate(data, base, neighbour, random.nextDouble()));
            }
        }
        return synthetic;
    }

    private static int sum(int[] values) {
        int total = 0;
        for (int value : values) {
            total += value;
        }
        return total;
    }
}
