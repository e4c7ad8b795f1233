package org.imbalance.controller;

import org.imbalance.config.SamplingConfig;
import org.imbalance.exceptions.DatasetException;
import org.imbalance.logging.Printer;
import org.imbalance.model.FeatureMatrix;
import org.imbalance.utilities.YeoJohnsonTransformer;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.NumericColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Encodes the categorical columns and power-transforms the numeric ones.
 */
public class PreprocessingController {

    private final SamplingConfig config;

    public PreprocessingController(SamplingConfig config) {
        this.config = config;
    }

    /**
     * @return a copy of {@code full} with the categorical columns label-encoded and the scale columns transformed
     */
    public Table preprocess(Table full) {
        Table table = full.copy();
        for (String column : config.getCategoricalColumns()) {
            labelEncode(table, column);
        }
        for (String column : config.getScaleColumns()) {
            powerTransform(table, column);
        }
        return table;
    }

    /**
     * Replaces the values of {@code column} with their position among the sorted distinct values.
     */
    public void labelEncode(Table table, String column) {
        Column<?> source = requireColumn(table, column);
        TreeSet<String> distinct = new TreeSet<>();
        for (int i = 0; i < source.size(); i++) {
            distinct.add(source.getString(i));
        }
        Map<String, Integer> codes = new HashMap<>();
        for (String value : distinct) {
            codes.put(value, codes.size());
        }

        double[] encoded = new double[source.size()];
        for (int i = 0; i < source.size(); i++) {
            encoded[i] = codes.get(source.getString(i));
        }
        table.replaceColumn(column, DoubleColumn.create(column, encoded));
        Printer.printlnGreen("Encoded '" + column + "' into " + codes.size() + " codes");
    }

    public void powerTransform(Table table, String column) {
        Column<?> source = requireColumn(table, column);
        if (!(source instanceof NumericColumn<?> numeric)) {
            throw new DatasetException("Column '" + column + "' must be numeric to be scaled, it is " + source.type());
        }
        YeoJohnsonTransformer transformer = new YeoJohnsonTransformer();
        double[] transformed = transformer.fitTransform(numeric.asDoubleArray());
        table.replaceColumn(column, DoubleColumn.create(column, transformed));
        Printer.printlnGreen(String.format(Locale.US, "Scaled '%s' (lambda=%.4f)", column, transformer.getLambda()));
    }

    /**
     * The feature matrix shared by every strategy: configured feature columns, in configured order.
     */
    public FeatureMatrix toFeatureMatrix(Table preprocessed) {
        List<Column<?>> columns = new ArrayList<>();
        for (String column : config.getFeatureColumns()) {
            columns.add(requireColumn(preprocessed, column));
        }
        Table features = Table.create(preprocessed.name(), columns.toArray(new Column<?>[0]));
        List<String> categorical = config.getCategoricalColumns().stream()
                .filter(features::containsColumn)
                .toList();
        FeatureMatrix matrix = new FeatureMatrix(features, categorical);
        Printer.println("Feature matrix shape: " + matrix.shape());
        return matrix;
    }

    private static Column<?> requireColumn(Table table, String column) {
        if (!table.containsColumn(column)) {
            throw new DatasetException("Required column '" + column + "' is missing");
        }
        return table.column(column);
    }
}
