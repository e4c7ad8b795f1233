package org.imbalance.controller;

import org.imbalance.config.SamplingConfig;
import org.imbalance.exceptions.DatasetException;
import org.imbalance.model.FeatureMatrix;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PreprocessingControllerTest {

    private PreprocessingController controller;
    private Table full;

    @BeforeEach
    void setUp() {
        SamplingConfig config = SamplingConfig.fromJson(new JSONObject()
                .put("dataset", new JSONObject().put("path", "data").put("file", "kddcup"))
                .put("categoricalColumns", List.of("protocol_type", "flag"))
                .put("scaleColumns", List.of("duration", "src_bytes"))
                .put("featureColumns", List.of("duration", "protocol_type", "flag", "src_bytes"))
                .put("smoteNcCategoricalFeatures", List.of(1, 2)));
        controller = new PreprocessingController(config);
        full = Table.create("kddcup",
                DoubleColumn.create("src_bytes", 181, 239, 235, 0, 54540),
                StringColumn.create("protocol_type", "udp", "tcp", "tcp", "icmp", "tcp"),
                DoubleColumn.create("duration", 0, 0, 0, 0, 2),
                StringColumn.create("flag", "SF", "SF", "S0", "REJ", "SF"),
                StringColumn.create("attack_category", "normal", "normal", "dos", "probe", "dos"));
    }

    @Test
    @DisplayName("Categories are encoded by their sorted position")
    void labelEncoding() {
        Table table = controller.preprocess(full);

        assertThat(table.doubleColumn("protocol_type").asDoubleArray()).containsExactly(2, 1, 1, 0, 1);
        assertThat(table.doubleColumn("flag").asDoubleArray()).containsExactly(2, 2, 1, 0, 2);
        assertThat(full.column("protocol_type")).isInstanceOf(StringColumn.class);
    }

    @Test
    @DisplayName("Scaled columns are standardized")
    void scaling() {
        Table table = controller.preprocess(full);

        assertThat(table.doubleColumn("src_bytes").mean()).isCloseTo(0.0, within(1e-9));
        assertThat(table.doubleColumn("duration").mean()).isCloseTo(0.0, within(1e-9));
        assertThat(table.stringColumn("attack_category").asList()).isEqualTo(full.stringColumn("attack_category").asList());
    }

    @Test
    @DisplayName("The feature matrix follows the configured column order")
    void featureMatrix() {
        FeatureMatrix matrix = controller.toFeatureMatrix(controller.preprocess(full));

        assertThat(matrix.columnNames()).containsExactly("duration", "protocol_type", "flag", "src_bytes");
        assertThat(matrix.isCategorical(1)).isTrue();
        assertThat(matrix.isCategorical(2)).isTrue();
        assertThat(matrix.isCategorical(3)).isFalse();
        assertThat(matrix.shape()).isEqualTo("(5, 4)");
    }

    @Test
    @DisplayName("A missing column stops preprocessing")
    void missingColumn() {
        full.removeColumns("flag");

        assertThatThrownBy(() -> controller.preprocess(full))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("'flag'");
    }

    @Test
    @DisplayName("Text cannot be scaled")
    void textScaled() {
        Table table = Table.create("kddcup", StringColumn.create("duration", "a", "b"));

        assertThatThrownBy(() -> controller.powerTransform(table, "duration"))
                .isInstanceOf(DatasetException.class);
    }
}
