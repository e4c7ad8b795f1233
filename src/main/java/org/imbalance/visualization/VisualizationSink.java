package org.imbalance.visualization;

import org.imbalance.model.LabelVector;

import java.util.Map;

/**
 * Where the evaluation loop sends its charts. Rendering must not change any result.
 */
public interface VisualizationSink {

    void confusionMatrix(LabelVector actual, LabelVector predicted, String title);

    void barChart(Map<String, Integer> counts, String title);
}
