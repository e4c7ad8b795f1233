package org.imbalance.resampling;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.imbalance.exceptions.ConfigurationException;
import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;
import org.imbalance.model.ResampledData;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

/**
 * SMOTE for data mixing continuous and categorical features.
 * <p>
 * The categorical positions are fixed at construction. Neighbours are found with
 * {@link MixedTypeDistance}, where a categorical mismatch costs the median
 * standard deviation of the class's continuous features. Continuous values are
 * interpolated, categorical ones take the most frequent value among the
 * neighbours of the seed row.
 */
public class SmoteNcResampler extends AbstractSmoteResampler {

    private final List<Integer> categoricalFeatures;

    public SmoteNcResampler(List<Integer> categoricalFeatures, int neighbours, long seed) {
        super("SMOTENC", neighbours, seed);
        this.categoricalFeatures = List.copyOf(categoricalFeatures);
    }

    @Override
    public ResampledData resample(FeatureMatrix features, LabelVector labels) throws Exception {
        validateCategoricalFeatures(features);
        return super.resample(features, labels);
    }

    void validateCategoricalFeatures(FeatureMatrix features) {
        if (categoricalFeatures.isEmpty()) {
            throw new ConfigurationException(getName() + " needs at least one categorical feature position");
        }
        Set<Integer> distinct = new LinkedHashSet<>(categoricalFeatures);
        if (distinct.size() != categoricalFeatures.size()) {
            throw new ConfigurationException(getName() + " categorical positions repeat: " + categoricalFeatures);
        }
        for (int position : categoricalFeatures) {
            if (position < 0 || position >= features.columnCount()) {
                throw new ConfigurationException(getName() + " categorical position " + position
                        + " is outside the " + features.columnCount() + " feature columns");
            }
            if (!features.isCategorical(position)) {
                throw new ConfigurationException(getName() + " categorical position " + position + " is column '"
                        + features.columnName(position) + "', which is not categorical");
            }
        }
        if (categoricalFeatures.size() == features.columnCount()) {
            throw new ConfigurationException(getName() + " needs at least one continuous feature");
        }
    }

    @Override
    protected List<Instance> generate(Instances data, int classIndex, int amount, Random random) {
        List<Integer> minority = rowsOfClass(data, classIndex);
        Set<Integer> categorical = new LinkedHashSet<>(categoricalFeatures);
        double penalty = medianContinuousStd(data, minority, categorical);

        NeighbourSearch search = new NeighbourSearch(data, new MixedTypeDistance(data, categorical, penalty));
        Map<Integer, int[]> neighbourCache = new HashMap<>();
        List<Instance> synthetic = new ArrayList<>(amount);
        for (int i = 0; i < amount; i++) {
            int row = minority.get(random.nextInt(minority.size()));
            int[] nn = neighbourCache.computeIfAbsent(row, r -> search.nearest(r, minority, neighbours));
            Instance base = data.instance(row);
            Instance neighbour = data.instance(nn[random.nextInt(nn.length)]);

            Instance instance = interpolate(data, base, neighbour, random.nextDouble());
            for (int position : categorical) {
                instance.setValue(position, mostFrequent(data, nn, position));
            }
            synthetic.add(instance);
        }
        return synthetic;
    }

    private static double medianContinuousStd(Instances data, List<Integer> rows, Set<Integer> categorical) {
        List<Double> deviations = new ArrayList<>();
        for (int a = 0; a < data.numAttributes(); a++) {
            if (a == data.classIndex() || categorical.contains(a)) {
                continue;
            }
            double[] values = new double[rows.size()];
            for (int i = 0; i < rows.size(); i++) {
                values[i] = data.instance(rows.get(i)).value(a);
            }
            deviations.add(new StandardDeviation(false).evaluate(values));
        }
        return new Median().evaluate(deviations.stream().mapToDouble(Double::doubleValue).toArray());
    }

    // ties go to the smallest encoded value
    private static double mostFrequent(Instances data, int[] rows, int attribute) {
        Map<Double, Integer> counts = new TreeMap<>();
        for (int row : rows) {
            counts.merge(data.instance(row).value(attribute), 1, Integer::sum);
        }
        double best = Double.NaN;
        int bestCount = -1;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
