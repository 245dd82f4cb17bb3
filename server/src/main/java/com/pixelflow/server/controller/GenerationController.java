package com.pixelflow.server.controller;

import com.pixelflow.server.error.GenerationCancelledException;
import com.pixelflow.server.error.InvalidImageException;
import com.pixelflow.server.error.PixelFlowException;
import com.pixelflow.server.generation.GenerationState;
import com.pixelflow.server.generation.Particle;
import com.pixelflow.server.generation.ParticleGenerationConfig;
import com.pixelflow.server.generation.QualityPreset;
import com.pixelflow.server.generation.SamplingStrategyType;
import com.pixelflow.server.generation.ScreenSize;
import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.service.CacheControlService;
import com.pixelflow.server.service.GenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@RestController
public class GenerationController {

    private static final Logger logger = LoggerFactory.getLogger(GenerationController.class);
    private static final float DEFAULT_SCREEN_WIDTH = 1920f;
    private static final float DEFAULT_SCREEN_HEIGHT = 1080f;

    private final GenerationService generationService;
    private final CacheControlService cacheControlService;

    public GenerationController(GenerationService generationService, CacheControlService cacheControlService) {
        this.generationService = generationService;
        this.cacheControlService = cacheControlService;
    }

    public static class GenerationRequest {
        public int width;
        public int height;
        // Row-major packed ARGB, width * height values
        public int[] pixels;
        public Float screenWidth;
        public Float screenHeight;
        public String preset;
        public String strategy;
        public Integer targetParticleCount;
        public boolean includeParticles;
    }

    public static class ParticleView {
        public float[] position;
        public float[] color;
        public float size;
    }

    public static class GenerationResponse {
        public int particleCount;
        public long durationMs;
        public List<ParticleView> particles;
    }

    @PostMapping("/generate-particles")
    public CompletableFuture<ResponseEntity<?>> generate(@RequestBody GenerationRequest request) {
        if (request.width <= 0 || request.height <= 0 || request.pixels == null
                || request.pixels.length != (long) request.width * request.height) {
            return completed(ResponseEntity.badRequest().body(error("Pixels must hold width * height ARGB values", null)));
        }
        if (generationService.isBusy()) {
            return completed(ResponseEntity.status(409).body(error("A generation is already in progress", null)));
        }

        ParticleGenerationConfig config;
        try {
            config = configFor(request);
        } catch (IllegalArgumentException e) {
            return completed(ResponseEntity.badRequest().body(error(e.getMessage(), null)));
        }

        logger.info("Received generation request for {}x{} image.", request.width, request.height);
        PixelBuffer buffer;
        try {
            buffer = PixelBuffer.fromArgbPixels(request.width, request.height, request.pixels);
        } catch (InvalidImageException e) {
            return completed(ResponseEntity.badRequest().body(error(e.getMessage(), e)));
        }
        ScreenSize screen = new ScreenSize(
                request.screenWidth != null ? request.screenWidth : DEFAULT_SCREEN_WIDTH,
                request.screenHeight != null ? request.screenHeight : DEFAULT_SCREEN_HEIGHT);

        long start = System.currentTimeMillis();
        return generationService.generate(buffer, config, screen)
                .<ResponseEntity<?>>handle((particles, failure) -> {
                    if (failure == null) {
                        return ResponseEntity.ok(toResponse(particles, System.currentTimeMillis() - start,
                                request.includeParticles));
                    }
                    return toErrorResponse(failure);
                });
    }

    @PostMapping("/generation/cancel")
    public ResponseEntity<?> cancel() {
        generationService.cancel();
        return ResponseEntity.accepted().body(statusBody(generationService.status()));
    }

    @GetMapping("/generation/status")
    public ResponseEntity<?> status() {
        return ResponseEntity.ok(statusBody(generationService.status()));
    }

    @GetMapping("/generation/cache")
    public ResponseEntity<?> cacheStats() {
        return ResponseEntity.ok(cacheControlService.stats());
    }

    @DeleteMapping("/generation/cache")
    public ResponseEntity<?> clearCache() {
        if (generationService.isBusy()) {
            return ResponseEntity.status(409).body(error("A generation is in progress", null));
        }
        int removed = cacheControlService.clearAll();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("removed", removed);
        return ResponseEntity.ok(body);
    }

    private static CompletableFuture<ResponseEntity<?>> completed(ResponseEntity<?> response) {
        return CompletableFuture.completedFuture(response);
    }

    private ParticleGenerationConfig configFor(GenerationRequest request) {
        ParticleGenerationConfig config = generationService.getDefaultConfig();
        if (request.preset != null) {
            ParticleGenerationConfig preset = ParticleGenerationConfig.forPreset(QualityPreset.fromName(request.preset));
            config = preset.withCachingEnabled(config.isCachingEnabled());
        }
        if (request.strategy != null) {
            config = config.withSamplingStrategy(SamplingStrategyType.fromName(request.strategy));
        }
        if (request.targetParticleCount != null) {
            if (request.targetParticleCount < 0) {
                throw new IllegalArgumentException("targetParticleCount must not be negative");
            }
            config = config.withTargetParticleCount(request.targetParticleCount);
        }
        return config;
    }

    private static GenerationResponse toResponse(List<Particle> particles, long durationMs, boolean includeParticles) {
        GenerationResponse response = new GenerationResponse();
        response.particleCount = particles.size();
        response.durationMs = durationMs;
        if (includeParticles) {
            response.particles = new ArrayList<>(particles.size());
            for (Particle p : particles) {
                ParticleView view = new ParticleView();
                view.position = p.getPosition();
                view.color = p.getColor();
                view.size = p.getSize();
                response.particles.add(view);
            }
        }
        return response;
    }

    private static ResponseEntity<?> toErrorResponse(Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause() : failure;
        if (cause instanceof GenerationCancelledException) {
            PixelFlowException e = (PixelFlowException) cause;
            return ResponseEntity.status(409).body(error(e.getMessage(), e));
        }
        if (cause instanceof PixelFlowException) {
            PixelFlowException e = (PixelFlowException) cause;
            return ResponseEntity.unprocessableEntity().body(error(e.getMessage(), e));
        }
        logger.error("Unexpected generation failure", cause);
        return ResponseEntity.internalServerError().body(error("Internal error", null));
    }

    private static Map<String, Object> error(String message, PixelFlowException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (e != null) {
            body.put("stage", e.getStage().name());
        }
        return body;
    }

    private static Map<String, Object> statusBody(GenerationState state) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("generating", state.isGenerating());
        body.put("progress", state.getProgress());
        body.put("stage", state.getStage().name());
        return body;
    }
}
