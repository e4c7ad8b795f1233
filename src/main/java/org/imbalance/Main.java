package org.imbalance;

import org.imbalance.classification.ClassifierCapability;
import org.imbalance.classification.ClassifierFactory;
import org.imbalance.config.SamplingConfig;
import org.imbalance.controller.DatasetController;
import org.imbalance.controller.EvaluationController;
import org.imbalance.controller.PreprocessingController;
import org.imbalance.controller.ScoringController;
import org.imbalance.logging.CollectLogger;
import org.imbalance.logging.PhaseTimer;
import org.imbalance.logging.Printer;
import org.imbalance.logging.RunLogFile;
import org.imbalance.model.AttackCategoryCount;
import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.RunContext;
import org.imbalance.model.ScoreLedger;
import org.imbalance.resampling.ResamplerFactory;
import org.imbalance.utilities.enums.LabelVariant;
import org.imbalance.utilities.writer.ScoreReportWriter;
import org.imbalance.visualization.ConsoleVisualizationSink;
import org.imbalance.visualization.PlotlyVisualizationSink;
import org.imbalance.visualization.VisualizationSink;
import tech.tablesaw.api.Table;

import java.nio.file.Path;
import java.util.function.Supplier;
import java.util.logging.Logger;

public class Main {

    private static final Logger logger = CollectLogger.getInstance().getLogger();

    private static final String RUN_NAME = "Sampling";

    public static void main(String[] args) {
        try {
            SamplingConfig config = SamplingConfig.load();
            try (RunLogFile ignored = RunLogFile.open(Path.of(config.getLogDir()), RUN_NAME)) {
                run(config);
            }
        } catch (Exception e) {
            Printer.errorPrint("Run aborted: " + e.getMessage());
            logger.severe(() -> "Run aborted by " + e.getClass().getSimpleName());
            System.exit(1);
        }
    }

    static ScoreLedger run(SamplingConfig config) throws Exception {
        DatasetController datasetController = new DatasetController(config);
        Table full;
        AttackCategoryCount attackCategoryCount;
        try (PhaseTimer ignored = PhaseTimer.start("Loading dataset")) {
            full = datasetController.load();
            attackCategoryCount = datasetController.attackCategoryCount(full);
        }

        PreprocessingController preprocessing = new PreprocessingController(config);
        Table preprocessed;
        try (PhaseTimer ignored = PhaseTimer.start("Encode and Scale")) {
            preprocessed = preprocessing.preprocess(full);
        }

        RunContext context;
        try (PhaseTimer ignored = PhaseTimer.start("Setting X")) {
            FeatureMatrix features = preprocessing.toFeatureMatrix(preprocessed);
            context = new RunContext(config, features,
                    datasetController.labels(full, LabelVariant.ATTACK_CATEGORY),
                    datasetController.labels(full, LabelVariant.TARGET),
                    attackCategoryCount);
        }

        VisualizationSink sink = config.isPlotsEnabled()
                ? new PlotlyVisualizationSink(Path.of(config.getPlotDir()))
                : new ConsoleVisualizationSink();
        Supplier<ClassifierCapability> classifiers = ClassifierFactory.capabilities(config);

        ScoreLedger ledger;
        try (PhaseTimer ignored = PhaseTimer.start("Sampling")) {
            EvaluationController evaluation = new EvaluationController(context,
                    ResamplerFactory.returnAllResamplers(config),
                    new ScoringController(classifiers, sink), sink);
            ledger = evaluation.run();
        }

        new ScoreReportWriter(Path.of(config.getReportDir())).save(ledger, context.getAttackCategoryCount());
        logger.info("Finished");
        return ledger;
    }
}
