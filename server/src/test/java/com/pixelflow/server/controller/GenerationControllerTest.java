package com.pixelflow.server.controller;

import com.pixelflow.server.generation.ParticleGenerationConfig;
import com.pixelflow.server.image.SyntheticImages;
import com.pixelflow.server.service.CacheControlService;
import com.pixelflow.server.service.GenerationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class GenerationControllerTest {

    @TempDir
    Path tempDir;

    private GenerationService service;
    private GenerationController controller;

    @BeforeEach
    public void setup() {
        service = new GenerationService(ParticleGenerationConfig.standard().withTargetParticleCount(40),
                tempDir.resolve("cache"));
        controller = new GenerationController(service, new CacheControlService(service));
    }

    @AfterEach
    public void teardown() {
        service.shutdown();
    }

    private static GenerationController.GenerationRequest request(int width, int height, int[] pixels) {
        GenerationController.GenerationRequest request = new GenerationController.GenerationRequest();
        request.width = width;
        request.height = height;
        request.pixels = pixels;
        return request;
    }

    private static int[] noise(int count) {
        Random random = new Random(11L);
        int[] pixels = new int[count];
        for (int i = 0; i < count; i++) {
            pixels[i] = 0xFF000000 | random.nextInt(0x1000000);
        }
        return pixels;
    }

    private ResponseEntity<?> call(GenerationController.GenerationRequest request) throws Exception {
        return controller.generate(request).get(10, TimeUnit.SECONDS);
    }

    @Test
    public void testGenerateReturnsParticleCount() throws Exception {
        ResponseEntity<?> response = call(request(16, 16, noise(256)));

        assertEquals(200, response.getStatusCode().value());
        GenerationController.GenerationResponse body = (GenerationController.GenerationResponse) response.getBody();
        assertEquals(40, body.particleCount);
        assertNull(body.particles);
    }

    @Test
    public void testRequestOverridesAndParticleViews() throws Exception {
        GenerationController.GenerationRequest request = request(16, 16, noise(256));
        request.preset = "draft";
        request.strategy = "uniform";
        request.targetParticleCount = 12;
        request.includeParticles = true;

        ResponseEntity<?> response = call(request);

        assertEquals(200, response.getStatusCode().value());
        GenerationController.GenerationResponse body = (GenerationController.GenerationResponse) response.getBody();
        assertEquals(12, body.particleCount);
        assertEquals(12, body.particles.size());
        assertEquals(3, body.particles.get(0).position.length);
        assertEquals(4, body.particles.get(0).color.length);
    }

    @Test
    public void testMismatchedPixelArrayIsBadRequest() throws Exception {
        assertEquals(400, call(request(16, 16, noise(10))).getStatusCode().value());
        assertEquals(400, call(request(0, 16, new int[0])).getStatusCode().value());
        assertEquals(400, call(request(4, 4, null)).getStatusCode().value());
    }

    @Test
    public void testOverflowingDimensionsAreBadRequest() throws Exception {
        // 65536 * 65536 wraps to 0 in int arithmetic
        assertEquals(400, call(request(65536, 65536, new int[0])).getStatusCode().value());
        assertFalse(service.isBusy());
    }

    @Test
    public void testUnknownPresetIsBadRequest() throws Exception {
        GenerationController.GenerationRequest request = request(4, 4, noise(16));
        request.preset = "cinematic";
        assertEquals(400, call(request).getStatusCode().value());

        GenerationController.GenerationRequest negative = request(4, 4, noise(16));
        negative.targetParticleCount = -1;
        assertEquals(400, call(negative).getStatusCode().value());
    }

    @Test
    public void testTransparentImageIsUnprocessable() throws Exception {
        int[] pixels = new int[64];
        Arrays.fill(pixels, SyntheticImages.TRANSPARENT);

        ResponseEntity<?> response = call(request(8, 8, pixels));

        assertEquals(422, response.getStatusCode().value());
        Map<?, ?> body = (Map<?, ?>) response.getBody();
        assertEquals("ANALYZING", body.get("stage"));
    }

    @Test
    public void testStatusAndCacheEndpoints() throws Exception {
        call(request(16, 16, noise(256)));

        Map<?, ?> status = (Map<?, ?>) controller.status().getBody();
        assertEquals(Boolean.FALSE, status.get("generating"));
        assertEquals("COMPLETED", status.get("stage"));

        CacheControlService.CacheStats stats = (CacheControlService.CacheStats) controller.cacheStats().getBody();
        assertEquals(1, stats.entries);

        ResponseEntity<?> cleared = controller.clearCache();
        assertEquals(200, cleared.getStatusCode().value());
        assertEquals(1, ((Map<?, ?>) cleared.getBody()).get("removed"));

        assertEquals(202, controller.cancel().getStatusCode().value());
    }
}
