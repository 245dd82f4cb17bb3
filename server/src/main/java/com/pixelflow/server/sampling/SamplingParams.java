package com.pixelflow.server.sampling;

import com.pixelflow.server.generation.QualityPreset;

/**
 * Sampling weights for one quality tier. Immutable, use the {@code with}
 * methods to derive variants.
 */
public final class SamplingParams {

    public static final float DEFAULT_EDGE_BIAS = 0.3f;

    private final QualityPreset quality;
    private final float importanceThreshold;
    private final float contrastWeight;
    private final float saturationWeight;
    private final int edgeRadius;
    private final float importantSamplingRatio;
    private final float topBottomRatio;
    private final boolean applyAntiClustering;
    private final float edgeBias;

    public SamplingParams(QualityPreset quality, float importanceThreshold, float contrastWeight,
            float saturationWeight, int edgeRadius, float importantSamplingRatio, float topBottomRatio,
            boolean applyAntiClustering, float edgeBias) {
        this.quality = quality;
        this.importanceThreshold = clamp01(importanceThreshold);
        this.contrastWeight = clamp01(contrastWeight);
        this.saturationWeight = clamp01(saturationWeight);
        this.edgeRadius = Math.max(1, edgeRadius);
        this.importantSamplingRatio = clamp01(importantSamplingRatio);
        this.topBottomRatio = clamp01(topBottomRatio);
        this.applyAntiClustering = applyAntiClustering;
        this.edgeBias = clamp01(edgeBias);
    }

    public static SamplingParams defaults() {
        return new SamplingParams(QualityPreset.STANDARD, 0.3f, 0.4f, 0.3f, 2, 0.7f, 0.5f, true,
                DEFAULT_EDGE_BIAS);
    }

    public SamplingParams withImportanceThreshold(float threshold) {
        return new SamplingParams(quality, threshold, contrastWeight, saturationWeight, edgeRadius,
                importantSamplingRatio, topBottomRatio, applyAntiClustering, edgeBias);
    }

    public SamplingParams withAntiClustering(boolean enabled) {
        return new SamplingParams(quality, importanceThreshold, contrastWeight, saturationWeight, edgeRadius,
                importantSamplingRatio, topBottomRatio, enabled, edgeBias);
    }

    public QualityPreset getQuality() {
        return quality;
    }

    public float getImportanceThreshold() {
        return importanceThreshold;
    }

    public float getContrastWeight() {
        return contrastWeight;
    }

    public float getSaturationWeight() {
        return saturationWeight;
    }

    public int getEdgeRadius() {
        return edgeRadius;
    }

    public float getImportantSamplingRatio() {
        return importantSamplingRatio;
    }

    public float getTopBottomRatio() {
        return topBottomRatio;
    }

    public boolean isApplyAntiClustering() {
        return applyAntiClustering;
    }

    public float getEdgeBias() {
        return edgeBias;
    }

    private static float clamp01(float v) {
        return Math.max(0f, Math.min(1f, v));
    }

    @Override
    public String toString() {
        return String.format("SamplingParams[%s threshold=%.2f contrast=%.2f saturation=%.2f radius=%d "
                + "important=%.2f topBottom=%.2f antiClustering=%s edgeBias=%.2f]",
                quality, importanceThreshold, contrastWeight, saturationWeight, edgeRadius,
                importantSamplingRatio, topBottomRatio, applyAntiClustering, edgeBias);
    }
}
