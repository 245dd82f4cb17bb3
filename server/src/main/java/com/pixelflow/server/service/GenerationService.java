package com.pixelflow.server.service;

import com.pixelflow.cache.ResultCache;
import com.pixelflow.server.analysis.ParallelImageAnalyzer;
import com.pixelflow.server.error.CacheException;
import com.pixelflow.server.generation.DefaultParticleAssembler;
import com.pixelflow.server.generation.GenerationCoordinator;
import com.pixelflow.server.generation.GenerationState;
import com.pixelflow.server.generation.Particle;
import com.pixelflow.server.generation.ParticleGenerationConfig;
import com.pixelflow.server.generation.ScreenSize;
import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.sampling.SamplingEngine;
import com.pixelflow.server.util.CachePathResolver;
import com.pixelflow.server.util.ConfigLoader;
import com.pixelflow.util.ParticleArrayCodec;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the process-wide coordinator and its cache.
 */
@Service
public class GenerationService {

    private static final Logger logger = LoggerFactory.getLogger(GenerationService.class);

    private final ParticleGenerationConfig defaultConfig;
    private final GenerationCoordinator coordinator;

    public GenerationService() {
        this(ConfigLoader.loadRoot());
    }

    GenerationService(ConfigLoader.ConfigRoot root) {
        this(ConfigLoader.toConfig(root), CachePathResolver.resolveCacheDirectory(root));
    }

    public GenerationService(ParticleGenerationConfig defaultConfig, Path cacheDirectory) {
        this.defaultConfig = defaultConfig;
        this.coordinator = new GenerationCoordinator(
                new ParallelImageAnalyzer(),
                new SamplingEngine(),
                new DefaultParticleAssembler(),
                openCache(cacheDirectory, defaultConfig.getCacheSizeLimitBytes()),
                defaultConfig.getMaxConcurrentOperations());
        logger.info("Generation service ready: {}", defaultConfig);
    }

    private static ResultCache<List<Particle>> openCache(Path directory, long sizeLimitBytes) {
        try {
            return new ResultCache<>(directory, sizeLimitBytes, new ParticleArrayCodec());
        } catch (CacheException e) {
            logger.warn("Result cache unavailable, generating without it", e);
            return null;
        }
    }

    public CompletableFuture<List<Particle>> generate(PixelBuffer buffer, ParticleGenerationConfig config,
            ScreenSize screenSize) {
        return coordinator.generate(buffer, config, screenSize,
                (progress, stage) -> logger.debug("Progress {} ({})", progress, stage));
    }

    public ParticleGenerationConfig getDefaultConfig() {
        return defaultConfig;
    }

    public GenerationState status() {
        return coordinator.snapshot();
    }

    public boolean isBusy() {
        return coordinator.isGenerating();
    }

    public void cancel() {
        coordinator.cancelGeneration();
    }

    public void clearCache() {
        coordinator.clearCache();
    }

    GenerationCoordinator getCoordinator() {
        return coordinator;
    }

    public ResultCache<List<Particle>> getCache() {
        return coordinator.getCache();
    }

    @PreDestroy
    public void shutdown() {
        coordinator.close();
    }
}
