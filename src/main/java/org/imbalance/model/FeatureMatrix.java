package org.imbalance.model;

import org.imbalance.exceptions.ConfigurationException;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.NumericColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, named numeric columns over N rows.
 * <p>
 * The matrix is immutable: it copies its input and only hands out copies, so the
 * same instance can be shared by every strategy and label variant of a run.
 */
public class FeatureMatrix {

    private final Table table;
    private final List<String> columnNames;
    private final Set<String> categoricalColumns;

    public FeatureMatrix(Table source, Collection<String> categoricalColumns) {
        Table copy = Table.create(source.name());
        for (Column<?> column : source.columns()) {
            if (!(column instanceof NumericColumn<?> numeric)) {
                throw new ConfigurationException("Column '" + column.name() + "' is not numeric (" + column.type() + ")");
            }
            copy.addColumns(DoubleColumn.create(column.name(), numeric.asDoubleArray()));
        }
        for (String categorical : categoricalColumns) {
            if (!copy.containsColumn(categorical)) {
                throw new ConfigurationException("Categorical column '" + categorical + "' is not a feature");
            }
        }
        this.table = copy;
        this.columnNames = List.copyOf(copy.columnNames());
        this.categoricalColumns = Set.copyOf(new LinkedHashSet<>(categoricalColumns));
    }

    public static FeatureMatrix fromRows(String name, List<String> columnNames, List<double[]> rows,
                                         Collection<String> categoricalColumns) {
        Table table = Table.create(name);
        for (int c = 0; c < columnNames.size(); c++) {
            double[] values = new double[rows.size()];
            for (int r = 0; r < rows.size(); r++) {
                values[r] = rows.get(r)[c];
            }
            table.addColumns(DoubleColumn.create(columnNames.get(c), values));
        }
        return new FeatureMatrix(table, categoricalColumns);
    }

    public String name() {
        return table.name();
    }

    public int rowCount() {
        return table.rowCount();
    }

    public int columnCount() {
        return columnNames.size();
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public String columnName(int index) {
        return columnNames.get(index);
    }

    public Set<String> categoricalColumns() {
        return categoricalColumns;
    }

    public boolean isCategorical(int index) {
        return categoricalColumns.contains(columnNames.get(index));
    }

    public double value(int row, int column) {
        return table.doubleColumn(column).getDouble(row);
    }

    public double[] row(int row) {
        double[] values = new double[columnNames.size()];
        for (int c = 0; c < values.length; c++) {
            values[c] = value(row, c);
        }
        return values;
    }

    public double[] column(String columnName) {
        return table.doubleColumn(columnName).asDoubleArray();
    }

    public String shape() {
        return "(" + rowCount() + ", " + columnCount() + ")";
    }
}
