package org.imbalance.model;

import org.imbalance.utilities.enums.LabelVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunContextTest {

    private final FeatureMatrix features = FeatureMatrix.fromRows("x", List.of("a"),
            List.of(new double[]{1}, new double[]{2}, new double[]{3}), List.of());

    @Test
    @DisplayName("Labels are looked up by variant and counted by attack category")
    void labels() {
        LabelVector category = new LabelVector("attack_category", List.of("normal", "dos", "dos"));
        LabelVector target = new LabelVector("target", List.of("normal", "attack", "attack"));

        RunContext context = new RunContext(null, features, category, target, AttackCategoryCount.of(category));

        assertThat(context.getLabels(LabelVariant.ATTACK_CATEGORY)).isSameAs(category);
        assertThat(context.getLabels(LabelVariant.TARGET)).isSameAs(target);
        assertThat(context.getAttackCategoryCount().count("dos")).isEqualTo(2);
        assertThat(context.getAttackCategoryCount().total()).isEqualTo(3);
        assertThat(context.getLedger().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Labels must be aligned with the feature rows")
    void misaligned() {
        LabelVector shortLabels = new LabelVector("target", List.of("normal"));

        assertThatThrownBy(() -> new RunContext(null, features, shortLabels, shortLabels,
                AttackCategoryCount.of(shortLabels)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
