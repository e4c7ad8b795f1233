package org.imbalance.model;

import org.imbalance.exceptions.KeyConflictException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Results of a run keyed by (strategy, label), in the order they were recorded.
 */
public class ScoreLedger {

    private final Map<ScoreKey, EvaluationResult> results = new LinkedHashMap<>();

    public void record(String strategyName, String labelName, EvaluationResult result) {
        ScoreKey key = new ScoreKey(strategyName, labelName);
        if (results.containsKey(key)) {
            throw new KeyConflictException("Score already recorded for " + key);
        }
        results.put(key, result);
    }

    public List<Map.Entry<ScoreKey, EvaluationResult>> all() {
        List<Map.Entry<ScoreKey, EvaluationResult>> entries = new ArrayList<>(results.size());
        results.forEach((key, value) -> entries.add(Map.entry(key, value)));
        return Collections.unmodifiableList(entries);
    }

    public Optional<EvaluationResult> get(String strategyName, String labelName) {
        return Optional.ofNullable(results.get(new ScoreKey(strategyName, labelName)));
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
