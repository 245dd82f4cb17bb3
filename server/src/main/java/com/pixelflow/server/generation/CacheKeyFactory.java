package com.pixelflow.server.generation;

import java.util.Locale;

/**
 * Builds cache keys from every input that changes a generation's output.
 */
public class CacheKeyFactory {

    static final String PREFIX = "generation_v1";

    private CacheKeyFactory() {
    }

    public static String create(int imageWidth, int imageHeight, ParticleGenerationConfig config) {
        return String.format(Locale.ROOT, "%s_%dx%d_%d_%s_%s_%.2f",
                PREFIX,
                imageWidth,
                imageHeight,
                config.getTargetParticleCount(),
                config.getQualityPreset().name().toLowerCase(Locale.ROOT),
                config.getSamplingStrategy().name().toLowerCase(Locale.ROOT),
                config.getImportanceThreshold());
    }
}
