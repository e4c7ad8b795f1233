package org.imbalance.controller;

import org.imbalance.config.SamplingConfig;
import org.imbalance.exceptions.DatasetException;
import org.imbalance.logging.Printer;
import org.imbalance.model.AttackCategoryCount;
import org.imbalance.model.LabelVector;
import org.imbalance.utilities.enums.FileExtension;
import org.imbalance.utilities.enums.LabelVariant;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;
import tech.tablesaw.io.csv.CsvReadOptions;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the KDD Cup 1999 feature and target tables and joins them column-wise.
 */
public class DatasetController {

    private final SamplingConfig config;

    public DatasetController(SamplingConfig config) {
        this.config = config;
    }

    public Table load() {
        Path directory = config.getDatasetDirectory();
        Table dataset = readTable(directory, config.getDatasetFile() + config.getProcessedSuffix());
        Table target = readTable(directory, config.getDatasetFile() + config.getTargetSuffix());

        Table full = concat(dataset, target);
        Printer.println("Dataset shape: (" + full.rowCount() + ", " + full.columnCount() + ")");
        return full;
    }

    public Table readTable(Path directory, String name) {
        File file = directory.resolve(name + FileExtension.CSV.getId()).toFile();
        if (!file.exists()) {
            throw new DatasetException("Dataset file not found: " + file.getPath());
        }
        try {
            Table table = Table.read().csv(CsvReadOptions.builder(file).tableName(name).build());
            Printer.printlnBlue("Read " + file.getPath() + ": " + table.rowCount() + " rows, "
                    + table.columnCount() + " columns");
            return table;
        } catch (Exception e) {
            throw new DatasetException("Cannot read CSV " + file.getPath() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Column-wise join of two tables describing the same rows.
     */
    public Table concat(Table dataset, Table target) {
        if (dataset.rowCount() != target.rowCount()) {
            throw new DatasetException("Feature table has " + dataset.rowCount() + " rows but target table has "
                    + target.rowCount());
        }
        Table full = dataset.copy();
        full.setName(config.getDatasetFile());
        for (Column<?> column : target.columns()) {
            if (full.containsColumn(column.name())) {
                throw new DatasetException("Column '" + column.name() + "' is present in both tables");
            }
            full.addColumns(column.copy());
        }
        for (LabelVariant variant : LabelVariant.values()) {
            if (!full.containsColumn(variant.getId())) {
                throw new DatasetException("Label column '" + variant.getId() + "' is missing");
            }
        }
        return full;
    }

    public LabelVector labels(Table full, LabelVariant variant) {
        return LabelVector.fromColumn(full.column(variant.getId()));
    }

    public AttackCategoryCount attackCategoryCount(Table full) {
        AttackCategoryCount counts = AttackCategoryCount.of(labels(full, LabelVariant.ATTACK_CATEGORY));
        for (Map.Entry<String, Integer> entry : counts.asMap().entrySet()) {
            Printer.println(String.format("  %-12s %8d", entry.getKey(), entry.getValue()));
        }
        return counts;
    }
}
