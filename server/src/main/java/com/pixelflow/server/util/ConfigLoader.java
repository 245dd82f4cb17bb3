package com.pixelflow.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pixelflow.server.generation.ImageDisplayMode;
import com.pixelflow.server.generation.ParticleGenerationConfig;
import com.pixelflow.server.generation.QualityPreset;
import com.pixelflow.server.generation.SamplingStrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads {@code /pixelflow_config.json}: a quality preset plus optional
 * overrides. Anything missing falls back to the preset's values.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_RESOURCE = "/pixelflow_config.json";
    private static final long MB = 1024L * 1024L;

    public static class GenerationOverrides {
        public String samplingStrategy;
        public Float importanceThreshold;
        public Float contrastWeight;
        public Float saturationWeight;
        public Integer edgeRadius;
        public Float minParticleSize;
        public Float maxParticleSize;
        public Integer targetParticleCount;
        public Boolean enableCaching;
        public Integer maxConcurrentOperations;
        public Boolean antiClustering;
        public String displayMode;
        public Float particleSpeed;
    }

    public static class ConfigRoot {
        public String preset = "standard";
        public String cache_directory;
        public Integer cache_size_limit_mb;
        public GenerationOverrides generation;
    }

    public static ConfigRoot loadRoot() {
        try (InputStream is = ConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                logger.info("No {} on classpath, using defaults", CONFIG_RESOURCE);
                return new ConfigRoot();
            }
            return loadRoot(is);
        } catch (IOException e) {
            logger.warn("Failed to read {}, using defaults: {}", CONFIG_RESOURCE, e.getMessage());
            return new ConfigRoot();
        }
    }

    public static ConfigRoot loadRoot(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(jsonStream, ConfigRoot.class);
    }

    public static ParticleGenerationConfig load() {
        return toConfig(loadRoot());
    }

    public static ParticleGenerationConfig toConfig(ConfigRoot root) {
        QualityPreset preset = QualityPreset.STANDARD;
        if (root.preset != null) {
            try {
                preset = QualityPreset.fromName(root.preset);
            } catch (IllegalArgumentException e) {
                logger.warn("{}, falling back to standard", e.getMessage());
            }
        }
        ParticleGenerationConfig config = ParticleGenerationConfig.forPreset(preset);

        if (root.cache_size_limit_mb != null && root.cache_size_limit_mb > 0) {
            config = config.withCacheSizeLimitBytes(root.cache_size_limit_mb * MB);
        }

        GenerationOverrides o = root.generation;
        if (o == null) {
            return config;
        }
        if (o.samplingStrategy != null) {
            config = config.withSamplingStrategy(SamplingStrategyType.fromName(o.samplingStrategy));
        }
        if (o.importanceThreshold != null) {
            config = config.withImportanceThreshold(o.importanceThreshold);
        }
        if (o.contrastWeight != null) {
            config = config.withContrastWeight(o.contrastWeight);
        }
        if (o.saturationWeight != null) {
            config = config.withSaturationWeight(o.saturationWeight);
        }
        if (o.edgeRadius != null) {
            config = config.withEdgeRadius(o.edgeRadius);
        }
        if (o.minParticleSize != null || o.maxParticleSize != null) {
            float min = o.minParticleSize != null ? o.minParticleSize : config.getMinParticleSize();
            float max = o.maxParticleSize != null ? o.maxParticleSize : config.getMaxParticleSize();
            config = config.withParticleSizeRange(min, max);
        }
        if (o.targetParticleCount != null) {
            config = config.withTargetParticleCount(o.targetParticleCount);
        }
        if (o.enableCaching != null) {
            config = config.withCachingEnabled(o.enableCaching);
        }
        if (o.maxConcurrentOperations != null) {
            config = config.withMaxConcurrentOperations(o.maxConcurrentOperations);
        }
        if (o.antiClustering != null) {
            config = config.withAntiClustering(o.antiClustering);
        }
        if (o.displayMode != null) {
            config = config.withDisplayMode(ImageDisplayMode.valueOf(o.displayMode.toUpperCase()));
        }
        if (o.particleSpeed != null) {
            config = config.withParticleSpeed(o.particleSpeed);
        }
        return config;
    }
}
