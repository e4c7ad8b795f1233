package org.imbalance.utilities.writer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.imbalance.logging.Printer;
import org.imbalance.model.AttackCategoryCount;
import org.imbalance.model.EvaluationResult;
import org.imbalance.model.ScoreKey;
import org.imbalance.model.ScoreLedger;
import org.imbalance.utilities.enums.FileExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the ledger of a run as a comparison table (log) and as JSON, together
 * with the attack category counts of the raw dataset.
 */
public class ScoreReportWriter {

    public static final String REPORT_NAME = "sampling_scores";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final Path reportDir;

    public ScoreReportWriter(Path reportDir) {
        this.reportDir = reportDir;
    }

    /**
     * One line of the report. Predictions are summarized by their length.
     */
    public record ScoreEntry(String strategy, String label, String classifier, double meanAccuracy,
                             double accuracyStdDev, List<Double> foldAccuracies, int resampledRows,
                             int predictions) {

        static ScoreEntry of(EvaluationResult result) {
            return new ScoreEntry(result.getStrategyName(), result.getLabelName(), result.getClassifierName(),
                    result.getMeanAccuracy(), result.getAccuracyStdDev(), result.getFoldAccuracies(),
                    result.getResampledRows(), result.getPredictions().size());
        }
    }

    /**
     * Root of the JSON report.
     */
    public record ScoreReport(Map<String, Integer> attackCategoryCount, List<ScoreEntry> scores) {
    }

    public static List<ScoreEntry> entries(ScoreLedger ledger) {
        return ledger.all().stream().map(Map.Entry::getValue).map(ScoreEntry::of).toList();
    }

    public static String comparisonTable(ScoreLedger ledger) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US, "%-20s %-16s %10s %10s %10s", "Strategy", "Label", "Mean", "Std", "Rows"));
        for (Map.Entry<ScoreKey, EvaluationResult> entry : ledger.all()) {
            EvaluationResult result = entry.getValue();
            sb.append(System.lineSeparator()).append(String.format(Locale.US, "%-20s %-16s %9.2f%% %10.4f %10d",
                    entry.getKey().strategyName(), entry.getKey().labelName(),
                    result.getMeanAccuracy() * 100, result.getAccuracyStdDev(), result.getResampledRows()));
        }
        return sb.toString();
    }

    public Path save(ScoreLedger ledger, AttackCategoryCount attackCategoryCount) throws IOException {
        Printer.println("Attack categories (" + attackCategoryCount.total() + " rows): " + attackCategoryCount);
        Printer.println(comparisonTable(ledger));

        Files.createDirectories(reportDir);
        Path file = reportDir.resolve(REPORT_NAME + FileExtension.JSON.getId());
        List<ScoreEntry> entries = entries(ledger);
        try {
            mapper.writerWithDefaultPrettyPrinter()
                    .writeValue(file.toFile(), new ScoreReport(attackCategoryCount.asMap(), entries));
            Printer.printlnGreen("Results saved to: " + file.toAbsolutePath() + " (" + entries.size() + " scores)");
        } catch (IOException e) {
            Printer.errorPrint("Failed to save results to " + file + ": " + e.getMessage());
            throw e;
        }
        return file;
    }
}
