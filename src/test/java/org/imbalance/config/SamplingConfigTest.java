package org.imbalance.config;

import org.imbalance.SyntheticData;
import org.imbalance.exceptions.ConfigurationException;
import org.imbalance.utilities.JsonReader;
import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SamplingConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("The bundled configuration describes the KDD Cup experiment")
    void bundledDefaults() {
        SamplingConfig config = SamplingConfig.fromJson(JsonReader.loadResource(SamplingConfig.DEFAULT_RESOURCE));

        assertThat(config.getDatasetDirectory()).isEqualTo(Path.of("data"));
        assertThat(config.getDatasetFile()).isEqualTo("kddcup");
        assertThat(config.getRandomState()).isEqualTo(20);
        assertThat(config.getSmoteRandomState()).isZero();
        assertThat(config.getFolds()).isEqualTo(10);
        assertThat(config.getEstimators()).isEqualTo(100);
        assertThat(config.getClassifierName()).isEqualTo("RandomForest");
        assertThat(config.getFeatureColumns()).hasSize(31);
        assertThat(config.getSmoteNcCategoricalFeatures()).containsExactly(1, 2, 3);
        assertThat(config.getSmoteNcCategoricalFeatures().stream().map(config.getFeatureColumns()::get))
                .containsExactly("protocol_type", "service", "flag");
        assertThat(config.isContinueOnError()).isFalse();
    }

    @Test
    @DisplayName("The dataset path can be overridden")
    void datasetOverride() {
        JSONObject json = SyntheticData.configJson(tempDir);

        SamplingConfig config = SamplingConfig.fromJson(json, "/mnt/kdd");

        assertThat(config.getDatasetDirectory()).isEqualTo(Path.of("/mnt/kdd"));
    }

    @Test
    @DisplayName("A configuration file on disk is read as well")
    void fromFile() throws Exception {
        Path file = tempDir.resolve("sampling.json");
        Files.writeString(file, SyntheticData.configJson(tempDir).put("folds", 4).toString());

        SamplingConfig config = SamplingConfig.fromJson(JsonReader.load(file));

        assertThat(config.getFolds()).isEqualTo(4);
        assertThat(config.getCategoricalColumns()).isEqualTo(SyntheticData.CATEGORICAL);
        assertThat(config.isPlotsEnabled()).isFalse();
    }

    @Test
    @DisplayName("A single fold is rejected")
    void invalidFolds() {
        JSONObject json = SyntheticData.configJson(tempDir).put("folds", 1);

        assertThatThrownBy(() -> SamplingConfig.fromJson(json))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("folds");
    }

    @Test
    @DisplayName("Every feature column must be either scaled or encoded")
    void unknownFeature() {
        JSONObject json = SyntheticData.configJson(tempDir);
        json.getJSONArray("featureColumns").put("mystery");

        assertThatThrownBy(() -> SamplingConfig.fromJson(json))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("mystery");
    }

    @Test
    @DisplayName("Missing sections and resources are configuration errors")
    void missing() {
        JSONObject json = SyntheticData.configJson(tempDir);
        json.remove("featureColumns");

        assertThatThrownBy(() -> SamplingConfig.fromJson(json)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> JsonReader.loadResource("missing.json"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> JsonReader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(ConfigurationException.class);
        assertThat(SamplingConfig.SYS_DATASET_PATH).isEqualTo("SAMPLING_DATASET_PATH");
    }
}
