package org.imbalance.model;

import org.imbalance.exceptions.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.IntColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureMatrixTest {

    @Test
    @DisplayName("Numeric columns are copied, categorical ones are flagged by position")
    void fromTable() {
        Table table = Table.create("kddcup",
                DoubleColumn.create("duration", 0.5, 1.5),
                IntColumn.create("protocol_type", 1, 0));

        FeatureMatrix matrix = new FeatureMatrix(table, List.of("protocol_type"));
        table.doubleColumn("duration").set(0, 99.0);

        assertThat(matrix.shape()).isEqualTo("(2, 2)");
        assertThat(matrix.value(0, 0)).isEqualTo(0.5);
        assertThat(matrix.row(0)).containsExactly(0.5, 1.0);
        assertThat(matrix.isCategorical(1)).isTrue();
        assertThat(matrix.isCategorical(0)).isFalse();
    }

    @Test
    @DisplayName("Text columns are not features")
    void nonNumeric() {
        Table table = Table.create("kddcup", StringColumn.create("service", "http", "ftp"));

        assertThatThrownBy(() -> new FeatureMatrix(table, List.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("service");
    }

    @Test
    @DisplayName("Categorical columns must be features")
    void unknownCategorical() {
        Table table = Table.create("kddcup", DoubleColumn.create("duration", 0.5));

        assertThatThrownBy(() -> new FeatureMatrix(table, List.of("flag")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Resampled data needs one label per row")
    void resampledDataLength() {
        FeatureMatrix matrix = FeatureMatrix.fromRows("x", List.of("a"), List.of(new double[]{1}, new double[]{2}),
                List.of());

        assertThatThrownBy(() -> new ResampledData(matrix, new LabelVector("target", List.of("n"))))
                .isInstanceOf(IllegalStateException.class);
        assertThat(new ResampledData(matrix, new LabelVector("target", List.of("n", "a"))).shape())
                .isEqualTo("x (2, 1),  y (2,)");
    }
}
