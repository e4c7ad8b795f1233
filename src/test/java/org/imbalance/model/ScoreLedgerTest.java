package org.imbalance.model;

import org.imbalance.exceptions.KeyConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreLedgerTest {

    private ScoreLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ScoreLedger();
    }

    private static EvaluationResult result(String strategy, String label, double accuracy) {
        return new EvaluationResult(strategy, label, "RandomForest", accuracy, 0.01, List.of(accuracy),
                new LabelVector(label, List.of("a", "b")), 2);
    }

    @Test
    @DisplayName("Entries come back in insertion order")
    void insertionOrder() {
        ledger.record("Original", "attack_category", result("Original", "attack_category", 0.9));
        ledger.record("Original", "target", result("Original", "target", 0.95));
        ledger.record("SMOTE", "attack_category", result("SMOTE", "attack_category", 0.8));

        assertThat(ledger.all().stream().map(Map.Entry::getKey).toList()).containsExactly(
                new ScoreKey("Original", "attack_category"),
                new ScoreKey("Original", "target"),
                new ScoreKey("SMOTE", "attack_category"));
        assertThat(ledger.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Recording the same key twice is a conflict")
    void duplicateKey() {
        ledger.record("SMOTE", "target", result("SMOTE", "target", 0.9));

        assertThatThrownBy(() -> ledger.record("SMOTE", "target", result("SMOTE", "target", 0.7)))
                .isInstanceOf(KeyConflictException.class)
                .hasMessageContaining("SMOTE / target");
        assertThat(ledger.get("SMOTE", "target")).hasValueSatisfying(
                r -> assertThat(r.getMeanAccuracy()).isEqualTo(0.9));
    }

    @Test
    @DisplayName("Lookup of a missing key is empty and the view is read-only")
    void lookup() {
        assertThat(ledger.isEmpty()).isTrue();
        assertThat(ledger.get("ADASYN", "target")).isEmpty();
        assertThatThrownBy(() -> ledger.all().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Results print the accuracy line")
    void resultLine() {
        assertThat(result("SMOTE", "target", 0.99123).toString())
                .isEqualTo("SMOTE - target - RandomForest Accuracy: 99.12% (+/- 1.00)");
    }
}
