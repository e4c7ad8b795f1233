package org.imbalance.utilities;

import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;
import org.imbalance.model.ResampledData;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Moves data between the run's feature matrix / label vector pair and Weka {@link Instances}.
 * <p>
 * Features become numeric attributes in matrix order, the label becomes the last,
 * nominal, attribute and is set as class.
 */
public class InstancesConverter {

    private InstancesConverter() {
        throw new AssertionError("Utility class");
    }

    public static Instances toInstances(FeatureMatrix features, LabelVector labels) {
        return toInstances(features, labels, labels.distinctValues());
    }

    public static Instances toInstances(FeatureMatrix features, LabelVector labels, List<String> classValues) {
        if (features.rowCount() != labels.size()) {
            throw new IllegalArgumentException("Features have " + features.rowCount()
                    + " rows but labels have " + labels.size());
        }
        Instances data = createEmpty(features, labels.getName(), classValues);
        Attribute classAttribute = data.classAttribute();

        for (int r = 0; r < features.rowCount(); r++) {
            double[] values = rowWithClassSlot(features, r);
            int classIndex = classAttribute.indexOfValue(labels.get(r));
            if (classIndex == -1) {
                throw new IllegalArgumentException("Label '" + labels.get(r) + "' at row " + r
                        + " is not one of " + classValues);
            }
            values[values.length - 1] = classIndex;
            data.add(new DenseInstance(1.0, values));
        }
        return data;
    }

    /**
     * Same layout as {@link #toInstances(FeatureMatrix, LabelVector, List)} with a missing class value, for prediction.
     */
    public static Instances toUnlabelledInstances(FeatureMatrix features, String labelName, List<String> classValues) {
        Instances data = createEmpty(features, labelName, classValues);
        for (int r = 0; r < features.rowCount(); r++) {
            double[] values = rowWithClassSlot(features, r);
            values[values.length - 1] = Utils.missingValue();
            data.add(new DenseInstance(1.0, values));
        }
        return data;
    }

    public static FeatureMatrix toFeatureMatrix(Instances data, String name, Collection<String> categoricalColumns) {
        List<String> columnNames = new ArrayList<>();
        for (int a = 0; a < data.numAttributes(); a++) {
            if (a != data.classIndex()) {
                columnNames.add(data.attribute(a).name());
            }
        }
        List<double[]> rows = new ArrayList<>(data.numInstances());
        for (int i = 0; i < data.numInstances(); i++) {
            Instance instance = data.instance(i);
            double[] row = new double[columnNames.size()];
            int c = 0;
            for (int a = 0; a < data.numAttributes(); a++) {
                if (a != data.classIndex()) {
                    row[c++] = instance.value(a);
                }
            }
            rows.add(row);
        }
        return FeatureMatrix.fromRows(name, columnNames, rows, categoricalColumns);
    }

    public static LabelVector toLabelVector(Instances data) {
        Attribute classAttribute = data.classAttribute();
        List<String> values = new ArrayList<>(data.numInstances());
        for (int i = 0; i < data.numInstances(); i++) {
            values.add(classAttribute.value((int) data.instance(i).classValue()));
        }
        return new LabelVector(classAttribute.name(), values);
    }

    /**
     * Converts resampled Weka data back, keeping name and categorical columns of the matrix it came from.
     */
    public static ResampledData toResampledData(Instances data, FeatureMatrix source) {
        FeatureMatrix features = toFeatureMatrix(data, source.name(), source.categoricalColumns());
        return new ResampledData(features, toLabelVector(data));
    }

    private static Instances createEmpty(FeatureMatrix features, String labelName, List<String> classValues) {
        ArrayList<Attribute> attributes = new ArrayList<>(features.columnCount() + 1);
        for (String column : features.columnNames()) {
            attributes.add(new Attribute(column));
        }
        attributes.add(new Attribute(labelName, new ArrayList<>(classValues)));

        Instances data = new Instances(features.name(), attributes, features.rowCount());
        data.setClassIndex(attributes.size() - 1);
        return data;
    }

    private static double[] rowWithClassSlot(FeatureMatrix features, int row) {
        double[] values = new double[features.columnCount() + 1];
        for (int c = 0; c < features.columnCount(); c++) {
            values[c] = features.value(row, c);
        }
        return values;
    }
}
