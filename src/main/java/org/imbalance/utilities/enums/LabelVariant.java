package org.imbalance.utilities.enums;

import lombok.Getter;

/**
 * The two target columns of the dataset, in the order the evaluation visits them.
 */
@Getter
public enum LabelVariant {
    ATTACK_CATEGORY("attack_category"), // fine grained, one class per attack family
    TARGET("target");                   // coarse

    private final String id;

    LabelVariant(String id) {
        this.id = id;
    }
}
