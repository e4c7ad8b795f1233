package org.imbalance.controller;

import org.imbalance.logging.PhaseTimer;
import org.imbalance.logging.Printer;
import org.imbalance.model.EvaluationResult;
import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;
import org.imbalance.model.ResampledData;
import org.imbalance.model.RunContext;
import org.imbalance.model.ScoreLedger;
import org.imbalance.resampling.Resampler;
import org.imbalance.utilities.enums.LabelVariant;
import org.imbalance.visualization.VisualizationSink;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every resampling strategy against every label variant and fills the run's ledger.
 */
public class EvaluationController {

    public static final String REWEIGHTED_COUNT_TITLE = "Re-weighted Count (attack_category)";

    private final RunContext context;
    private final List<Resampler> resamplers;
    private final ScoringController scoring;
    private final VisualizationSink sink;
    private final boolean continueOnError;
    private final List<String> failures = new ArrayList<>();

    public EvaluationController(RunContext context, List<Resampler> resamplers,
                                ScoringController scoring, VisualizationSink sink) {
        this.context = context;
        this.resamplers = List.copyOf(resamplers);
        this.scoring = scoring;
        this.sink = sink;
        this.continueOnError = context.getConfig() != null && context.getConfig().isContinueOnError();
    }

    public ScoreLedger run() throws Exception {
        FeatureMatrix features = context.getFeatures();
        ScoreLedger ledger = context.getLedger();

        for (Resampler resampler : resamplers) {
            try (PhaseTimer ignored = PhaseTimer.start("Sampling with " + resampler.getName())) {
                for (LabelVariant variant : LabelVariant.values()) {
                    LabelVector labels = context.getLabels(variant);
                    EvaluationResult result;
                    try {
                        result = evaluate(resampler, features, labels, variant);
                    } catch (Exception e) {
                        if (!continueOnError) {
                            throw e;
                        }
                        String failure = resampler.getName() + " - " + labels.getName() + ": " + e.getMessage();
                        failures.add(failure);
                        Printer.errorPrint("Skipping " + failure);
                        continue;
                    }
                    ledger.record(resampler.getName(), labels.getName(), result);
                }
            }
        }

        Printer.printlnBlue("Recorded " + ledger.size() + " scores"
                + (failures.isEmpty() ? "" : ", " + failures.size() + " iterations failed"));
        return ledger;
    }

    private EvaluationResult evaluate(Resampler resampler, FeatureMatrix features, LabelVector labels,
                                      LabelVariant variant) throws Exception {
        ResampledData resampled = resampler.resample(features, labels);
        Printer.println("Shape after sampling with " + resampler.getName() + " - " + resampled.shape());

        EvaluationResult result = scoring.score(resampled, labels, resampler.getName());

        if (variant == LabelVariant.ATTACK_CATEGORY) {
            sink.barChart(resampled.labels().valueCounts(), REWEIGHTED_COUNT_TITLE + " - " + resampler.getName());
        }
        return result;
    }

    /**
     * Iterations skipped when errors do not abort the run, empty otherwise.
     */
    public List<String> getFailures() {
        return List.copyOf(failures);
    }
}
