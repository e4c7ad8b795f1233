package org.imbalance.controller;

import org.imbalance.classification.ClassifierCapability;
import org.imbalance.classification.CrossValidationResult;
import org.imbalance.logging.Printer;
import org.imbalance.model.EvaluationResult;
import org.imbalance.model.LabelVector;
import org.imbalance.model.ResampledData;
import org.imbalance.visualization.VisualizationSink;

import java.util.function.Supplier;

/**
 * Scores one resampled dataset: stratified cross-validation accuracy plus the
 * out-of-fold confusion matrix.
 */
public class ScoringController {

    private final Supplier<ClassifierCapability> classifiers;
    private final VisualizationSink sink;

    public ScoringController(Supplier<ClassifierCapability> classifiers, VisualizationSink sink) {
        this.classifiers = classifiers;
        this.sink = sink;
    }

    public EvaluationResult score(ResampledData resampled, LabelVector original, String strategyName) throws Exception {
        ClassifierCapability classifier = classifiers.get();
        LabelVector labels = resampled.labels();

        CrossValidationResult cv = classifier.crossValidate(resampled.features(), labels);

        EvaluationResult result = new EvaluationResult(strategyName, labels.getName(), classifier.getName(),
                cv.getMeanAccuracy(), cv.getAccuracyStdDev(), cv.getFoldAccuracies(),
                cv.getPredictions(), resampled.size());

        Printer.printlnGreen(result.toString());
        Printer.println("Original rows: " + original.size() + ", resampled rows: " + resampled.size());

        sink.confusionMatrix(labels, cv.getPredictions(),
                strategyName + " - " + classifier.getName() + " - Label " + labels.getName());
        return result;
    }
}
