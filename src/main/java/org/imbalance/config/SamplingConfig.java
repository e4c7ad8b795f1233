package org.imbalance.config;

import lombok.Getter;
import org.imbalance.exceptions.ConfigurationException;
import org.imbalance.logging.Printer;
import org.imbalance.utilities.JsonReader;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Static configuration of an experiment run, read from {@value #DEFAULT_RESOURCE}.
 * <p>
 * The dataset location can be overridden with the {@value #SYS_DATASET_PATH}
 * environment variable.
 */
@Getter
public class SamplingConfig {

    public static final String DEFAULT_RESOURCE = "sampling.json";
    public static final String SYS_DATASET_PATH = "SAMPLING_DATASET_PATH";

    private final String datasetPath;
    private final String datasetFile;
    private final String processedSuffix;
    private final String targetSuffix;

    private final int randomState;
    private final int smoteRandomState;
    private final int folds;
    private final int estimators;
    private final String classifierName;
    private final int neighbours;
    private final int dangerNeighbours;

    private final List<String> categoricalColumns;
    private final List<String> scaleColumns;
    private final List<String> featureColumns;
    private final List<Integer> smoteNcCategoricalFeatures;

    private final String logDir;
    private final String plotDir;
    private final String reportDir;
    private final boolean plotsEnabled;
    private final boolean continueOnError;

    private SamplingConfig(JSONObject json, String datasetPathOverride) {
        try {
            JSONObject dataset = json.getJSONObject("dataset");
            this.datasetPath = datasetPathOverride != null ? datasetPathOverride : dataset.getString("path");
            this.datasetFile = dataset.getString("file");
            this.processedSuffix = dataset.optString("processedSuffix", "_processed");
            this.targetSuffix = dataset.optString("targetSuffix", "_target");

            this.randomState = json.optInt("randomState", 20);
            this.smoteRandomState = json.optInt("smoteRandomState", 0);
            this.folds = json.optInt("folds", 10);
            this.estimators = json.optInt("estimators", 100);
            this.classifierName = json.optString("classifier", "RandomForest");
            this.neighbours = json.optInt("neighbours", 5);
            this.dangerNeighbours = json.optInt("dangerNeighbours", 10);

            this.categoricalColumns = strings(json.getJSONArray("categoricalColumns"));
            this.scaleColumns = strings(json.getJSONArray("scaleColumns"));
            this.featureColumns = strings(json.getJSONArray("featureColumns"));
            this.smoteNcCategoricalFeatures = integers(json.getJSONArray("smoteNcCategoricalFeatures"));

            JSONObject output = section(json, "output");
            this.logDir = output.optString("logDir", "logs");
            this.plotDir = output.optString("plotDir", "output/plots");
            this.reportDir = output.optString("reportDir", "output/results");
            this.plotsEnabled = output.optBoolean("plotsEnabled", true);

            this.continueOnError = section(json, "evaluation").optBoolean("continueOnError", false);
        } catch (JSONException e) {
            throw new ConfigurationException("Invalid sampling configuration: " + e.getMessage(), e);
        }
        validate();
    }

    public static SamplingConfig load() {
        return fromJson(JsonReader.loadResource(DEFAULT_RESOURCE), getDatasetPathOverride());
    }

    public static SamplingConfig load(Path path) {
        return fromJson(JsonReader.load(path), getDatasetPathOverride());
    }

    public static SamplingConfig fromJson(JSONObject json) {
        return fromJson(json, null);
    }

    public static SamplingConfig fromJson(JSONObject json, String datasetPathOverride) {
        return new SamplingConfig(json, datasetPathOverride);
    }

    private void validate() {
        if (folds < 2) {
            throw new ConfigurationException("folds must be at least 2, was " + folds);
        }
        if (estimators < 1) {
            throw new ConfigurationException("estimators must be positive, was " + estimators);
        }
        if (neighbours < 1 || dangerNeighbours < 1) {
            throw new ConfigurationException("neighbour counts must be positive");
        }
        for (String column : featureColumns) {
            if (!scaleColumns.contains(column) && !categoricalColumns.contains(column)) {
                throw new ConfigurationException("Feature column '" + column + "' is neither scaled nor categorical");
            }
        }
    }

    public Path getDatasetDirectory() {
        return Path.of(datasetPath);
    }

    private static String getDatasetPathOverride() {
        String path = System.getenv(SYS_DATASET_PATH);
        if (path == null || path.isBlank()) {
            return null;
        }
        Printer.printlnBlue(SYS_DATASET_PATH + " set, reading dataset from " + path);
        return path;
    }

    private static JSONObject section(JSONObject json, String key) {
        return json.has(key) ? json.getJSONObject(key) : new JSONObject();
    }

    private static List<String> strings(JSONArray array) {
        List<String> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            values.add(array.getString(i));
        }
        return List.copyOf(values);
    }

    private static List<Integer> integers(JSONArray array) {
        List<Integer> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            values.add(array.getInt(i));
        }
        return List.copyOf(values);
    }
}
