package org.imbalance.visualization;

import org.imbalance.logging.Printer;
import org.imbalance.model.LabelVector;
import org.imbalance.utilities.enums.FileExtension;
import tech.tablesaw.api.IntColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.plotly.api.Heatmap;
import tech.tablesaw.plotly.api.VerticalBarPlot;
import tech.tablesaw.plotly.components.Figure;
import tech.tablesaw.plotly.components.Page;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes each chart as a standalone Plotly HTML page under the plot directory and
 * logs the same data as text.
 */
public class PlotlyVisualizationSink extends ConsoleVisualizationSink {

    private static final String DIV_NAME = "target";

    private final Path plotDir;

    public PlotlyVisualizationSink(Path plotDir) {
        this.plotDir = plotDir;
    }

    @Override
    public void confusionMatrix(LabelVector actual, LabelVector predicted, String title) {
        super.confusionMatrix(actual, predicted, title);
        Table table = confusionTable(actual, predicted);
        write(Heatmap.create(title, table, ACTUAL, PREDICTED), title);
    }

    @Override
    public void barChart(Map<String, Integer> counts, String title) {
        super.barChart(counts, title);
        StringColumn labels = StringColumn.create("label");
        IntColumn values = IntColumn.create("count");
        counts.forEach((label, count) -> {
            labels.append(label);
            values.append(count);
        });
        write(VerticalBarPlot.create(title, Table.create(title, labels, values), "label", "count"), title);
    }

    Path fileFor(String title) {
        return plotDir.resolve(fileName(title) + FileExtension.HTML.getId());
    }

    static String fileName(String title) {
        return title.replaceAll("\\s+-\\s+", "_")
                .replaceAll("[^A-Za-z0-9_-]+", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
    }

    private void write(Figure figure, String title) {
        Path file = fileFor(title);
        try {
            Files.createDirectories(plotDir);
            String html = Page.pageBuilder(figure, DIV_NAME).build().asJavascript();
            Files.writeString(file, html, StandardCharsets.UTF_8);
            Printer.printlnGreen("Plot saved to: " + file.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write plot " + file, e);
        }
    }
}
