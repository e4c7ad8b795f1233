package org.imbalance.model;

import lombok.Getter;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.columns.Column;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A named categorical column, index aligned with the {@link FeatureMatrix} it is paired with.
 */
@Getter
public class LabelVector {

    private final String name;
    private final List<String> values;

    public LabelVector(String name, List<String> values) {
        this.name = Objects.requireNonNull(name, "name");
        this.values = List.copyOf(values);
    }

    public static LabelVector fromColumn(Column<?> column) {
        List<String> values = new ArrayList<>(column.size());
        for (int i = 0; i < column.size(); i++) {
            values.add(column.getString(i));
        }
        return new LabelVector(column.name(), values);
    }

    public int size() {
        return values.size();
    }

    public String get(int index) {
        return values.get(index);
    }

    public List<String> distinctValues() {
        return List.copyOf(new TreeSet<>(values));
    }

    /**
     * Count of rows per label, largest class first (ties broken by label).
     */
    public Map<String, Integer> valueCounts() {
        Map<String, Integer> counts = new HashMap<>();
        for (String value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    /**
     * Largest class count divided by the smallest one, 1.0 for a perfectly balanced vector.
     */
    public double imbalanceRatio() {
        Map<String, Integer> counts = valueCounts();
        if (counts.isEmpty()) {
            return 1.0;
        }
        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        int min = counts.values().stream().mapToInt(Integer::intValue).min().orElse(0);
        return (double) max / min;
    }

    public StringColumn toColumn() {
        return StringColumn.create(name, values);
    }

    @Override
    public String toString() {
        return name + valueCounts();
    }
}
