package org.imbalance.resampling;

import org.imbalance.logging.Printer;
import weka.classifiers.functions.SMO;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SelectedTag;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * SMOTE seeded by the support vectors of a linear SVM that separates the class
 * from all the others.
 * <p>
 * Support vectors surrounded only by other classes are dropped as noise. Vectors
 * with at least half foreign neighbours interpolate towards their own class,
 * the others extrapolate away from it.
 */
public class SvmSmoteResampler extends AbstractSmoteResampler {

    private static final String REST = "rest";
    private static final String MINORITY = "minority";
    private static final double MARGIN = 1.0 + 1e-6;
    private static final double OUT_STEP = 0.5;

    private final int dangerNeighbours;

    public SvmSmoteResampler(int neighbours, int dangerNeighbours, long seed) {
        super("SVMSMOTE", neighbours, seed);
        this.dangerNeighbours = dangerNeighbours;
    }

    @Override
    protected List<Instance> generate(Instances data, int classIndex, int amount, Random random) throws Exception {
        NeighbourSearch search = new NeighbourSearch(data, distanceFunction(data));
        List<Integer> all = allRows(data);
        List<Integer> minority = rowsOfClass(data, classIndex);

        List<Integer> supportVectors = supportVectors(data, classIndex, minority);
        List<Integer> danger = new ArrayList<>();
        List<Integer> safe = new ArrayList<>();
        for (int row : supportVectors) {
            int[] nn = search.nearest(row, all, dangerNeighbours);
            int foreign = search.countForeign(row, nn);
            if (foreign == nn.length) {
                continue; // noise
            }
            if (foreign * 2 >= nn.length) {
                danger.add(row);
            } else {
                safe.add(row);
            }
        }
        if (danger.isEmpty() && safe.isEmpty()) {
            Printer.printYellow(getName() + ": no usable support vector in class '" + classLabel(data, classIndex)
                    + "', using every row of the class");
            danger = minority;
        }

        int fromDanger = (int) Math.round((double) amount * danger.size() / (danger.size() + safe.size()));
        Map<Integer, int[]> neighbourCache = new HashMap<>();
        List<Instance> synthetic = new ArrayList<>(amount);
        for (int i = 0; i < amount; i++) {
            boolean inDanger = i < fromDanger;
            List<Integer> seeds = inDanger ? danger : safe;
            int row = seeds.get(random.nextInt(seeds.size()));
            int[] nn = neighbourCache.computeIfAbsent(row, r -> search.nearest(r, minority, neighbours));
            Instance base = data.instance(row);
            Instance neighbour = data.instance(nn[random.nextInt(nn.length)]);

            double gap = inDanger ? random.nextDouble() : -OUT_STEP * random.nextDouble();
            synthetic.add(interpolate(data, base, neighbour, gap));
        }
        return synthetic;
    }

    /**
     * Rows of the class on or inside the margin of a linear one-vs-rest SMO.
     */
    private List<Integer> supportVectors(Instances data, int classIndex, List<Integer> minority) throws Exception {
        Instances binary = oneVersusRest(data, classIndex);
        SMO smo = new SMO();
        smo.setFilterType(new SelectedTag(SMO.FILTER_NONE, SMO.TAGS_FILTER));
        smo.setRandomSeed((int) seed);
        smo.buildClassifier(binary);

        double[] weights = smo.sparseWeights()[0][1];
        int[] indices = smo.sparseIndices()[0][1];
        double bias = smo.bias()[0][1];
        if (weights == null || indices == null) {
            Printer.printYellow(getName() + ": SMO returned no linear weights for class '"
                    + classLabel(data, classIndex) + "'");
            return minority;
        }

        List<Integer> supportVectors = new ArrayList<>();
        for (int row : minority) {
            Instance instance = binary.instance(row);
            double output = -bias;
            for (int k = 0; k < indices.length; k++) {
                output += weights[k] * instance.value(indices[k]);
            }
            // the "minority" value is the second class of the binary problem, so it sits on the positive side
            if (output <= MARGIN) {
                supportVectors.add(row);
            }
        }
        Printer.printlnGreen(getName() + ": " + supportVectors.size() + " support vectors out of "
                + minority.size() + " rows of class '" + classLabel(data, classIndex) + "'");
        return supportVectors;
    }

    private static Instances oneVersusRest(Instances data, int classIndex) {
        ArrayList<Attribute> attributes = new ArrayList<>(data.numAttributes());
        for (int a = 0; a < data.numAttributes(); a++) {
            if (a == data.classIndex()) {
                attributes.add(new Attribute(data.classAttribute().name(), new ArrayList<>(List.of(REST, MINORITY))));
            } else {
                attributes.add(new Attribute(data.attribute(a).name()));
            }
        }
        Instances binary = new Instances(data.relationName() + "_vs_rest", attributes, data.numInstances());
        binary.setClassIndex(data.classIndex());
        for (int i = 0; i < data.numInstances(); i++) {
            double[] values = data.instance(i).toDoubleArray();
            values[data.classIndex()] = (int) data.instance(i).classValue() == classIndex ? 1 : 0;
            binary.add(new DenseInstance(1.0, values));
        }
        return binary;
    }
}
