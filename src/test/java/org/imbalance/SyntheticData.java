package org.imbalance;

import org.imbalance.config.SamplingConfig;
import org.imbalance.model.FeatureMatrix;
import org.imbalance.model.LabelVector;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeded, overlapping Gaussian classes shaped like the preprocessed KDD features:
 * a continuous column, three label-encoded categorical columns, then more continuous columns.
 */
public final class SyntheticData {

    public static final List<String> COLUMNS = List.of(
            "f0", "cat1", "cat2", "cat3", "f4", "f5", "f6", "f7", "f8", "f9");
    public static final List<String> CATEGORICAL = List.of("cat1", "cat2", "cat3");
    public static final String LABEL = "attack_category";

    private final FeatureMatrix features;
    private final LabelVector labels;

    private SyntheticData(FeatureMatrix features, LabelVector labels) {
        this.features = features;
        this.labels = labels;
    }

    /**
     * Class sizes in declaration order, e.g. {@code classes("A", 1000, "B", 50)}.
     */
    public static Map<String, Integer> classes(Object... labelsAndCounts) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < labelsAndCounts.length; i += 2) {
            counts.put((String) labelsAndCounts[i], (Integer) labelsAndCounts[i + 1]);
        }
        return counts;
    }

    /**
     * @param counts rows per class, in the order rows are generated
     * @param separation distance between the means of consecutive classes, in standard deviations
     */
    public static SyntheticData generate(Map<String, Integer> counts, double separation, long seed) {
        Random random = new Random(seed);
        List<double[]> rows = new ArrayList<>();
        List<String> values = new ArrayList<>();
        int classIndex = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            double mean = classIndex * separation;
            for (int i = 0; i < entry.getValue(); i++) {
                double[] row = new double[COLUMNS.size()];
                for (int c = 0; c < row.length; c++) {
                    if (CATEGORICAL.contains(COLUMNS.get(c))) {
                        // codes 0..3, biased towards the class index
                        row[c] = random.nextDouble() < 0.6 ? classIndex % 4 : random.nextInt(4);
                    } else {
                        row[c] = mean + random.nextGaussian();
                    }
                }
                rows.add(row);
                values.add(entry.getKey());
            }
            classIndex++;
        }
        return new SyntheticData(FeatureMatrix.fromRows("synthetic", COLUMNS, rows, CATEGORICAL),
                new LabelVector(LABEL, values));
    }

    public FeatureMatrix features() {
        return features;
    }

    public LabelVector labels() {
        return labels;
    }

    /**
     * Configuration matching {@link #COLUMNS}, with smaller cross-validation and forest settings.
     */
    public static JSONObject configJson(Path root) {
        List<String> scale = COLUMNS.stream().filter(c -> !CATEGORICAL.contains(c)).toList();
        return new JSONObject()
                .put("dataset", new JSONObject()
                        .put("path", root.resolve("data").toString())
                        .put("file", "kddcup"))
                .put("randomState", 20)
                .put("smoteRandomState", 0)
                .put("folds", 3)
                .put("estimators", 10)
                .put("classifier", "RandomForest")
                .put("neighbours", 5)
                .put("dangerNeighbours", 10)
                .put("categoricalColumns", new JSONArray(CATEGORICAL))
                .put("scaleColumns", new JSONArray(scale))
                .put("featureColumns", new JSONArray(COLUMNS))
                .put("smoteNcCategoricalFeatures", new JSONArray(List.of(1, 2, 3)))
                .put("output", new JSONObject()
                        .put("logDir", root.resolve("logs").toString())
                        .put("plotDir", root.resolve("plots").toString())
                        .put("reportDir", root.resolve("results").toString())
                        .put("plotsEnabled", false));
    }

    public static SamplingConfig config(Path root) {
        return SamplingConfig.fromJson(configJson(root));
    }
}
