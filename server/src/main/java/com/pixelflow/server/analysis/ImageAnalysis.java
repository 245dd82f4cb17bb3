package com.pixelflow.server.analysis;

import com.pixelflow.server.image.Rgba;

import java.util.Collections;
import java.util.List;

/**
 * Immutable per-image descriptor. Width and height are those of the source
 * buffer, {@code analysisScale} is below 1 when the statistics were computed
 * on a downsampled copy.
 */
public final class ImageAnalysis {

    private final int width;
    private final int height;
    private final float analysisScale;
    private final Rgba averageColor;
    private final float contrast;
    private final float brightness;
    private final float pixelDensity;
    private final float edgeDensity;
    private final float saturation;
    private final int complexity;
    private final List<Rgba> dominantColors;
    private final float colorVariance;

    public ImageAnalysis(int width, int height, float analysisScale, Rgba averageColor,
            float contrast, float brightness, float pixelDensity, float edgeDensity,
            float saturation, int complexity, List<Rgba> dominantColors, float colorVariance) {
        this.width = width;
        this.height = height;
        this.analysisScale = analysisScale;
        this.averageColor = averageColor;
        this.contrast = contrast;
        this.brightness = brightness;
        this.pixelDensity = pixelDensity;
        this.edgeDensity = edgeDensity;
        this.saturation = saturation;
        this.complexity = complexity;
        this.dominantColors = Collections.unmodifiableList(dominantColors);
        this.colorVariance = colorVariance;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public float getAnalysisScale() {
        return analysisScale;
    }

    public Rgba getAverageColor() {
        return averageColor;
    }

    public float getContrast() {
        return contrast;
    }

    public float getBrightness() {
        return brightness;
    }

    public float getPixelDensity() {
        return pixelDensity;
    }

    public float getEdgeDensity() {
        return edgeDensity;
    }

    public float getSaturation() {
        return saturation;
    }

    public int getComplexity() {
        return complexity;
    }

    /** Up to five colours, most frequent first. */
    public List<Rgba> getDominantColors() {
        return dominantColors;
    }

    public float getColorVariance() {
        return colorVariance;
    }

    @Override
    public String toString() {
        return String.format("ImageAnalysis[%dx%d scale=%.3f contrast=%.3f brightness=%.3f density=%.3f "
                + "edges=%.3f saturation=%.3f complexity=%d variance=%.3f]",
                width, height, analysisScale, contrast, brightness, pixelDensity,
                edgeDensity, saturation, complexity, colorVariance);
    }
}
