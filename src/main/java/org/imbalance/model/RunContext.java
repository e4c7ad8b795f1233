package org.imbalance.model;

import lombok.Getter;
import org.imbalance.config.SamplingConfig;
import org.imbalance.utilities.enums.LabelVariant;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a run works on. Features and labels are shared read-only by every
 * iteration, the ledger is the only thing that changes.
 */
@Getter
public class RunContext {

    private final SamplingConfig config;
    private final FeatureMatrix features;
    private final Map<LabelVariant, LabelVector> labels;
    private final AttackCategoryCount attackCategoryCount;
    private final ScoreLedger ledger;

    public RunContext(SamplingConfig config, FeatureMatrix features, LabelVector attackCategory, LabelVector target,
                      AttackCategoryCount attackCategoryCount) {
        this.config = config;
        this.features = Objects.requireNonNull(features, "features");
        Map<LabelVariant, LabelVector> byVariant = new EnumMap<>(LabelVariant.class);
        byVariant.put(LabelVariant.ATTACK_CATEGORY, checkAligned(features, attackCategory));
        byVariant.put(LabelVariant.TARGET, checkAligned(features, target));
        this.labels = Collections.unmodifiableMap(byVariant);
        this.attackCategoryCount = Objects.requireNonNull(attackCategoryCount, "attackCategoryCount");
        this.ledger = new ScoreLedger();
    }

    public LabelVector getLabels(LabelVariant variant) {
        return labels.get(variant);
    }

    private static LabelVector checkAligned(FeatureMatrix features, LabelVector labels) {
        Objects.requireNonNull(labels, "labels");
        if (labels.size() != features.rowCount()) {
            throw new IllegalArgumentException("Label '" + labels.getName() + "' has " + labels.size()
                    + " values for " + features.rowCount() + " feature rows");
        }
        return labels;
    }
}
