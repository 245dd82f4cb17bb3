package com.pixelflow.server.generation;

/**
 * Quality tier. Carries the multipliers applied to the base sampling weights,
 * the hybrid split and the particle size range used by the assembler.
 */
public enum QualityPreset {
    DRAFT(0.5f, 0.7f, 0.5f, -1, new float[] { 0.2f, 0.2f, 0.6f }, 3f, 7f),
    STANDARD(1.0f, 1.0f, 1.0f, 0, new float[] { 0.4f, 0.4f, 0.2f }, 2f, 9f),
    HIGH(1.2f, 1.3f, 1.2f, 1, new float[] { 0.45f, 0.4f, 0.15f }, 1.5f, 12f),
    ULTRA(1.5f, 1.5f, 1.4f, 2, new float[] { 0.5f, 0.35f, 0.15f }, 0.8f, 15f);

    private final float thresholdMultiplier;
    private final float contrastMultiplier;
    private final float saturationMultiplier;
    private final int edgeRadiusDelta;
    private final float[] hybridSplit;
    private final float minSize;
    private final float maxSize;

    QualityPreset(float thresholdMultiplier, float contrastMultiplier, float saturationMultiplier,
            int edgeRadiusDelta, float[] hybridSplit, float minSize, float maxSize) {
        this.thresholdMultiplier = thresholdMultiplier;
        this.contrastMultiplier = contrastMultiplier;
        this.saturationMultiplier = saturationMultiplier;
        this.edgeRadiusDelta = edgeRadiusDelta;
        this.hybridSplit = hybridSplit;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    public float getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    public float getContrastMultiplier() {
        return contrastMultiplier;
    }

    public float getSaturationMultiplier() {
        return saturationMultiplier;
    }

    public int getEdgeRadiusDelta() {
        return edgeRadiusDelta;
    }

    /** Fractions of the budget for very-important, mid-importance and uniform samples. */
    public float[] getHybridSplit() {
        return hybridSplit.clone();
    }

    public float getMinSize() {
        return minSize;
    }

    public float getMaxSize() {
        return maxSize;
    }

    public static QualityPreset fromName(String name) {
        for (QualityPreset preset : values()) {
            if (preset.name().equalsIgnoreCase(name)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown quality preset: " + name);
    }
}
