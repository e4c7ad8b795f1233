package org.imbalance.utilities.writer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.imbalance.model.AttackCategoryCount;
import org.imbalance.model.EvaluationResult;
import org.imbalance.model.LabelVector;
import org.imbalance.model.ScoreLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreReportWriterTest {

    @TempDir
    Path tempDir;

    private static ScoreLedger ledger() {
        ScoreLedger ledger = new ScoreLedger();
        ledger.record("Original", "attack_category", new EvaluationResult("Original", "attack_category",
                "RandomForest", 0.991, 0.002, List.of(0.989, 0.993),
                new LabelVector("attack_category", List.of("normal", "dos", "dos")), 3));
        ledger.record("SMOTE", "target", new EvaluationResult("SMOTE", "target",
                "RandomForest", 0.95, 0.01, List.of(0.94, 0.96),
                new LabelVector("target", List.of("normal", "attack", "attack", "normal")), 4));
        return ledger;
    }

    private static AttackCategoryCount counts() {
        return AttackCategoryCount.of(new LabelVector("attack_category", List.of("normal", "dos", "dos")));
    }

    @Test
    @DisplayName("Scores are saved as JSON in ledger order, predictions as a count")
    void save() throws Exception {
        Path file = new ScoreReportWriter(tempDir.resolve("results")).save(ledger(), counts());

        assertThat(file.getFileName().toString()).isEqualTo("sampling_scores.json");
        JsonNode root = new ObjectMapper().readTree(file.toFile()).get("scores");
        assertThat(root.isArray()).isTrue();
        assertThat(root).hasSize(2);
        assertThat(root.get(0).get("strategy").asText()).isEqualTo("Original");
        assertThat(root.get(0).get("predictions").asInt()).isEqualTo(3);
        assertThat(root.get(1).get("label").asText()).isEqualTo("target");
        assertThat(root.get(1).get("meanAccuracy").asDouble()).isEqualTo(0.95);
        assertThat(root.get(1).get("foldAccuracies")).hasSize(2);
    }

    @Test
    @DisplayName("The raw attack category counts are part of the report, largest first")
    void attackCategoryCounts() throws Exception {
        Path file = new ScoreReportWriter(tempDir.resolve("results")).save(ledger(), counts());

        JsonNode counts = new ObjectMapper().readTree(file.toFile()).get("attackCategoryCount");
        assertThat(counts.get("dos").asInt()).isEqualTo(2);
        assertThat(counts.get("normal").asInt()).isEqualTo(1);
        assertThat(counts.fieldNames()).toIterable().containsExactly("dos", "normal");
    }

    @Test
    @DisplayName("The comparison table has a header and one line per score")
    void comparisonTable() {
        String table = ScoreReportWriter.comparisonTable(ledger());

        assertThat(table.lines()).hasSize(3);
        assertThat(table).contains("Strategy").contains("99.10%").contains("SMOTE");
    }
}
