package com.pixelflow.server.generation;

import com.pixelflow.server.sampling.SamplingParams;

/**
 * Immutable generation settings. Start from one of the presets and derive
 * variants with the {@code with} methods.
 */
public final class ParticleGenerationConfig implements HasDisplayMode, HasParticleSpeed {

    private static final long MB = 1024L * 1024L;

    private SamplingStrategyType samplingStrategy;
    private QualityPreset qualityPreset;
    private float importanceThreshold;
    private float contrastWeight;
    private float saturationWeight;
    private int edgeRadius;
    private float minParticleSize;
    private float maxParticleSize;
    private int targetParticleCount;
    private boolean cachingEnabled;
    private long cacheSizeLimitBytes;
    private int maxConcurrentOperations;
    private float importantSamplingRatio = 0.7f;
    private float topBottomRatio = 0.5f;
    private boolean antiClustering = true;
    private float edgeBias = SamplingParams.DEFAULT_EDGE_BIAS;
    private ImageDisplayMode displayMode = ImageDisplayMode.FIT;
    private float particleSpeed = 1.0f;

    private ParticleGenerationConfig() {
    }

    private static ParticleGenerationConfig preset(SamplingStrategyType strategy, QualityPreset quality,
            float threshold, float contrast, float saturation, int radius, float minSize, float maxSize,
            int target, boolean caching, long cacheLimit, int maxOps) {
        ParticleGenerationConfig c = new ParticleGenerationConfig();
        c.samplingStrategy = strategy;
        c.qualityPreset = quality;
        c.importanceThreshold = threshold;
        c.contrastWeight = contrast;
        c.saturationWeight = saturation;
        c.edgeRadius = radius;
        c.minParticleSize = minSize;
        c.maxParticleSize = maxSize;
        c.targetParticleCount = target;
        c.cachingEnabled = caching;
        c.cacheSizeLimitBytes = cacheLimit;
        c.maxConcurrentOperations = maxOps;
        return c;
    }

    public static ParticleGenerationConfig draft() {
        return preset(SamplingStrategyType.UNIFORM, QualityPreset.DRAFT, 0.1f, 0.2f, 0.1f, 1,
                3f, 6f, 500, false, 10 * MB, 2);
    }

    public static ParticleGenerationConfig standard() {
        return preset(SamplingStrategyType.IMPORTANCE, QualityPreset.STANDARD, 0.3f, 0.4f, 0.3f, 2,
                2f, 8f, 1000, true, 100 * MB, 4);
    }

    public static ParticleGenerationConfig high() {
        return preset(SamplingStrategyType.HYBRID, QualityPreset.HIGH, 0.45f, 0.45f, 0.35f, 3,
                1.5f, 10f, 2000, true, 300 * MB, 4);
    }

    public static ParticleGenerationConfig ultra() {
        return preset(SamplingStrategyType.HYBRID, QualityPreset.ULTRA, 0.5f, 0.5f, 0.4f, 3,
                1f, 12f, 5000, true, 500 * MB, 4);
    }

    public static ParticleGenerationConfig forPreset(QualityPreset preset) {
        switch (preset) {
            case DRAFT:
                return draft();
            case HIGH:
                return high();
            case ULTRA:
                return ultra();
            case STANDARD:
            default:
                return standard();
        }
    }

    /**
     * Sampling weights scaled for this config's quality tier.
     */
    public SamplingParams samplingParams() {
        QualityPreset q = qualityPreset;
        return new SamplingParams(q,
                importanceThreshold * q.getThresholdMultiplier(),
                contrastWeight * q.getContrastMultiplier(),
                saturationWeight * q.getSaturationMultiplier(),
                Math.max(1, edgeRadius + q.getEdgeRadiusDelta()),
                importantSamplingRatio,
                topBottomRatio,
                antiClustering,
                edgeBias);
    }

    private ParticleGenerationConfig copy() {
        ParticleGenerationConfig c = new ParticleGenerationConfig();
        c.samplingStrategy = samplingStrategy;
        c.qualityPreset = qualityPreset;
        c.importanceThreshold = importanceThreshold;
        c.contrastWeight = contrastWeight;
        c.saturationWeight = saturationWeight;
        c.edgeRadius = edgeRadius;
        c.minParticleSize = minParticleSize;
        c.maxParticleSize = maxParticleSize;
        c.targetParticleCount = targetParticleCount;
        c.cachingEnabled = cachingEnabled;
        c.cacheSizeLimitBytes = cacheSizeLimitBytes;
        c.maxConcurrentOperations = maxConcurrentOperations;
        c.importantSamplingRatio = importantSamplingRatio;
        c.topBottomRatio = topBottomRatio;
        c.antiClustering = antiClustering;
        c.edgeBias = edgeBias;
        c.displayMode = displayMode;
        c.particleSpeed = particleSpeed;
        return c;
    }

    public ParticleGenerationConfig withSamplingStrategy(SamplingStrategyType value) {
        ParticleGenerationConfig c = copy();
        c.samplingStrategy = value;
        return c;
    }

    public ParticleGenerationConfig withQualityPreset(QualityPreset value) {
        ParticleGenerationConfig c = copy();
        c.qualityPreset = value;
        return c;
    }

    public ParticleGenerationConfig withImportanceThreshold(float value) {
        ParticleGenerationConfig c = copy();
        c.importanceThreshold = value;
        return c;
    }

    public ParticleGenerationConfig withContrastWeight(float value) {
        ParticleGenerationConfig c = copy();
        c.contrastWeight = value;
        return c;
    }

    public ParticleGenerationConfig withSaturationWeight(float value) {
        ParticleGenerationConfig c = copy();
        c.saturationWeight = value;
        return c;
    }

    public ParticleGenerationConfig withEdgeRadius(int value) {
        ParticleGenerationConfig c = copy();
        c.edgeRadius = value;
        return c;
    }

    public ParticleGenerationConfig withParticleSizeRange(float min, float max) {
        ParticleGenerationConfig c = copy();
        c.minParticleSize = min;
        c.maxParticleSize = max;
        return c;
    }

    public ParticleGenerationConfig withTargetParticleCount(int value) {
        ParticleGenerationConfig c = copy();
        c.targetParticleCount = value;
        return c;
    }

    public ParticleGenerationConfig withCachingEnabled(boolean value) {
        ParticleGenerationConfig c = copy();
        c.cachingEnabled = value;
        return c;
    }

    public ParticleGenerationConfig withCacheSizeLimitBytes(long value) {
        ParticleGenerationConfig c = copy();
        c.cacheSizeLimitBytes = value;
        return c;
    }

    public ParticleGenerationConfig withMaxConcurrentOperations(int value) {
        ParticleGenerationConfig c = copy();
        c.maxConcurrentOperations = value;
        return c;
    }

    public ParticleGenerationConfig withAntiClustering(boolean value) {
        ParticleGenerationConfig c = copy();
        c.antiClustering = value;
        return c;
    }

    public ParticleGenerationConfig withDisplayMode(ImageDisplayMode value) {
        ParticleGenerationConfig c = copy();
        c.displayMode = value;
        return c;
    }

    public ParticleGenerationConfig withParticleSpeed(float value) {
        ParticleGenerationConfig c = copy();
        c.particleSpeed = value;
        return c;
    }

    public SamplingStrategyType getSamplingStrategy() {
        return samplingStrategy;
    }

    public QualityPreset getQualityPreset() {
        return qualityPreset;
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

    public float getMinParticleSize() {
        return minParticleSize;
    }

    public float getMaxParticleSize() {
        return maxParticleSize;
    }

    public int getTargetParticleCount() {
        return targetParticleCount;
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public long getCacheSizeLimitBytes() {
        return cacheSizeLimitBytes;
    }

    public int getMaxConcurrentOperations() {
        return maxConcurrentOperations;
    }

    public boolean isAntiClustering() {
        return antiClustering;
    }

    @Override
    public ImageDisplayMode getDisplayMode() {
        return displayMode;
    }

    @Override
    public float getParticleSpeed() {
        return particleSpeed;
    }

    @Override
    public String toString() {
        return "ParticleGenerationConfig{" + qualityPreset + ", " + samplingStrategy
                + ", target=" + targetParticleCount + ", threshold=" + importanceThreshold
                + ", caching=" + cachingEnabled + "}";
    }
}
