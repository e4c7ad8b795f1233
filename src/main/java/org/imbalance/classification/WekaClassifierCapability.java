package org.imbalance.classification;

import org.imbalance.exceptions.InsufficientSamplesException;
import org.imbalance.logging.Printer;
import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;
import org.imbalance.utilities.InstancesConverter;
import weka.classifiers.AbstractClassifier;
import weka.classifiers.Classifier;
import weka.classifiers.Evaluation;
import weka.classifiers.meta.FilteredClassifier;
import weka.core.Attribute;
import weka.core.Instances;
import weka.core.Utils;
import weka.filters.unsupervised.attribute.Remove;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * {@link ClassifierCapability} backed by a Weka classifier. The template is never
 * trained itself: every fit and every fold works on a fresh copy.
 */
public class WekaClassifierCapability implements ClassifierCapability {

    private static final String UNKNOWN = "?";
    static final String ROW_ATTRIBUTE = "__row_index";

    private final String name;
    private final Classifier template;
    private final int folds;
    private final int seed;

    private Classifier fitted;
    private String labelName;
    private List<String> classValues;

    public WekaClassifierCapability(String name, Classifier template, int folds, int seed) {
        this.name = name;
        this.template = template;
        this.folds = folds;
        this.seed = seed;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void fit(FeatureMatrix features, LabelVector labels) throws Exception {
        Instances data = InstancesConverter.toInstances(features, labels);
        Classifier copy = AbstractClassifier.makeCopy(template);
        copy.buildClassifier(data);
        this.fitted = copy;
        this.labelName = labels.getName();
        this.classValues = labels.distinctValues();
    }

    @Override
    public LabelVector predict(FeatureMatrix features) throws Exception {
        if (fitted == null) {
            throw new IllegalStateException(name + " has not been fitted");
        }
        Instances data = InstancesConverter.toUnlabelledInstances(features, labelName, classValues);
        List<String> predicted = new ArrayList<>(data.numInstances());
        for (int i = 0; i < data.numInstances(); i++) {
            predicted.add(label(data, fitted.classifyInstance(data.instance(i))));
        }
        return new LabelVector(labelName, predicted);
    }

    /* =========================
       STRATIFIED K-FOLD
       ========================= */
    @Override
    public CrossValidationResult crossValidate(FeatureMatrix features, LabelVector labels) throws Exception {
        if (folds < 2) {
            throw new IllegalArgumentException("At least 2 folds are needed, got " + folds);
        }
        for (Map.Entry<String, Integer> entry : labels.valueCounts().entrySet()) {
            if (entry.getValue() < folds) {
                throw new InsufficientSamplesException(entry.getKey(), entry.getValue(), folds,
                        folds + "-fold stratified cross-validation");
            }
        }

        Instances data = withRowIndex(InstancesConverter.toInstances(features, labels));
        data.randomize(new Random(seed));
        data.stratify(folds);

        String[] predicted = new String[data.numInstances()];
        List<Double> accuracies = new ArrayList<>(folds);

        for (int f = 0; f < folds; f++) {
            Instances train = data.trainCV(folds, f);
            Instances test = data.testCV(folds, f);

            Classifier copy = AbstractClassifier.makeCopy(withoutRowIndex());
            copy.buildClassifier(train);

            Evaluation eval = new Evaluation(train);
            double[] foldPredictions = eval.evaluateModel(copy, test);
            for (int i = 0; i < test.numInstances(); i++) {
                predicted[(int) test.instance(i).value(0)] = label(test, foldPredictions[i]);
            }
            double accuracy = eval.pctCorrect() / 100.0;
            accuracies.add(accuracy);

            Printer.printlnGreen(String.format(Locale.US, "[F%d] %s accuracy=%.4f (train=%d, test=%d)",
                    f + 1, name, accuracy, train.numInstances(), test.numInstances()));
        }

        return new CrossValidationResult(accuracies, new LabelVector(labels.getName(), Arrays.asList(predicted)));
    }

    /**
     * Prepends a numeric attribute holding each instance's original position, so
     * out-of-fold predictions can be put back in row order after shuffling.
     */
    private static Instances withRowIndex(Instances data) {
        data.insertAttributeAt(new Attribute(ROW_ATTRIBUTE), 0);
        for (int i = 0; i < data.numInstances(); i++) {
            data.instance(i).setValue(0, i);
        }
        return data;
    }

    // The row index is bookkeeping only, the model must not train on it.
    private Classifier withoutRowIndex() throws Exception {
        Remove remove = new Remove();
        remove.setAttributeIndices("first");

        FilteredClassifier filtered = new FilteredClassifier();
        filtered.setFilter(remove);
        filtered.setClassifier(AbstractClassifier.makeCopy(template));
        return filtered;
    }

    private static String label(Instances data, double prediction) {
        if (Utils.isMissingValue(prediction)) {
            return UNKNOWN;
        }
        return data.classAttribute().value((int) prediction);
    }
}
