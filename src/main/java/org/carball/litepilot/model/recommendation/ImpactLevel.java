package org.carball.litepilot.model.recommendation;

public enum ImpactLevel {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int weight;

    ImpactLevel(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
