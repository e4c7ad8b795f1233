package org.imbalance.visualization;

import org.imbalance.logging.Printer;
import org.imbalance.model.LabelVector;
import tech.tablesaw.api.Table;

import java.util.Map;

/**
 * Logs the charts as text tables. Used when plot files are disabled.
 */
public class ConsoleVisualizationSink implements VisualizationSink {

    static final String ACTUAL = "actual";
    static final String PREDICTED = "predicted";

    @Override
    public void confusionMatrix(LabelVector actual, LabelVector predicted, String title) {
        Table crossTab = confusionTable(actual, predicted).xTabCounts(ACTUAL, PREDICTED);
        Printer.println(title + System.lineSeparator() + crossTab.printAll());
    }

    @Override
    public void barChart(Map<String, Integer> counts, String title) {
        StringBuilder sb = new StringBuilder(title);
        counts.forEach((label, count) -> sb.append(System.lineSeparator())
                .append(String.format("  %-12s %8d", label, count)));
        Printer.println(sb.toString());
    }

    static Table confusionTable(LabelVector actual, LabelVector predicted) {
        if (actual.size() != predicted.size()) {
            throw new IllegalArgumentException("Cannot compare " + actual.size() + " labels with "
                    + predicted.size() + " predictions");
        }
        return Table.create("confusion",
                actual.toColumn().setName(ACTUAL),
                predicted.toColumn().setName(PREDICTED));
    }
}
