package com.entity.pipeline.core.model;

/**
 * Components of one weight contribution to a relationship edge.
 */
public record WeightComponents(double base, double proximity, double typeBonus, double riskBonus) {

    public static WeightComponents baseOnly(double base) {
        return new WeightComponents(base, 0, 0, 0);
    }

    public double total() {
        return base + proximity + typeBonus + riskBonus;
    }
}
