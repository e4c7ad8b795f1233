package org.imbalance.model;

public record ScoreKey(String strategyName, String labelName) {

    @Override
    public String toString() {
        return strategyName + " / " + labelName;
    }
}
