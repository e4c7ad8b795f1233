package org.imbalance.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rows per attack category in the raw dataset, before any resampling. Used for reporting only.
 */
public class AttackCategoryCount {

    private final Map<String, Integer> counts;

    private AttackCategoryCount(Map<String, Integer> counts) {
        this.counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static AttackCategoryCount of(LabelVector attackCategory) {
        return new AttackCategoryCount(attackCategory.valueCounts());
    }

    public Map<String, Integer> asMap() {
        return counts;
    }

    public int count(String category) {
        return counts.getOrDefault(category, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
