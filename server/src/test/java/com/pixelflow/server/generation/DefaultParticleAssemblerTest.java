package com.pixelflow.server.generation;

import com.pixelflow.server.error.AssemblyFailedException;
import com.pixelflow.server.image.Rgba;
import com.pixelflow.server.sampling.Sample;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultParticleAssemblerTest {

    private final DefaultParticleAssembler assembler = new DefaultParticleAssembler();

    private static List<Sample> grid(int width, int height) {
        List<Sample> samples = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                samples.add(new Sample(x, y, new Rgba(x / (float) width, y / (float) height, 0.5f, 1f)));
            }
        }
        return samples;
    }

    @Test
    public void testOneParticlePerSampleWithSampleColor() {
        List<Sample> samples = grid(10, 5);
        List<Particle> particles = assembler.assemble(samples, 10, 5, ParticleGenerationConfig.standard(),
                new ScreenSize(800, 600));

        assertEquals(samples.size(), particles.size());
        for (int i = 0; i < particles.size(); i++) {
            Particle p = particles.get(i);
            assertArrayEquals(samples.get(i).getColor().toArray(), p.getColor(), 0f);
            assertArrayEquals(p.getColor(), p.getOriginalColor(), 0f);
            assertArrayEquals(p.getPosition(), p.getTargetPosition(), 0f);
            assertEquals(p.getSize(), p.getBaseSize(), 0f);
            assertEquals(i % 7 == 0, p.isIdleChaoticMotion());
        }
    }

    @Test
    public void testFitKeepsWideImageInsideScreen() {
        // 2:1 image on a square screen
        List<Particle> particles = assembler.assemble(Collections.singletonList(new Sample(0, 0, Rgba.OPAQUE_BLACK)),
                100, 50, ParticleGenerationConfig.standard(), new ScreenSize(100, 100));

        float[] position = particles.get(0).getPosition();
        assertEquals(-0.99f, position[0], 1e-5f);
        assertEquals(0.49f, position[1], 1e-5f);
        assertEquals(0f, position[2], 0f);
    }

    @Test
    public void testFillClampsOverflowToScreenEdge() {
        ParticleGenerationConfig fill = ParticleGenerationConfig.standard().withDisplayMode(ImageDisplayMode.FILL);
        List<Particle> particles = assembler.assemble(Collections.singletonList(new Sample(0, 0, Rgba.OPAQUE_BLACK)),
                100, 50, fill, new ScreenSize(100, 100));

        float[] position = particles.get(0).getPosition();
        assertEquals(-1f, position[0], 0f);
        assertEquals(0.98f, position[1], 1e-5f);
    }

    @Test
    public void testPositionsStayInUnitSquare() {
        ParticleGenerationConfig fill = ParticleGenerationConfig.standard().withDisplayMode(ImageDisplayMode.FILL);
        for (Particle p : assembler.assemble(grid(20, 3), 20, 3, fill, new ScreenSize(300, 900))) {
            assertTrue(Math.abs(p.getPosition()[0]) <= 1f);
            assertTrue(Math.abs(p.getPosition()[1]) <= 1f);
        }
    }

    @Test
    public void testVelocityScalesWithParticleSpeed() {
        ParticleGenerationConfig fast = ParticleGenerationConfig.standard().withParticleSpeed(3f);
        List<Particle> particles = assembler.assemble(grid(4, 4), 4, 4, fast, new ScreenSize(640, 480));
        for (Particle p : particles) {
            float[] v = p.getVelocity();
            assertEquals(0.03f, (float) Math.hypot(v[0], v[1]), 1e-5f);
            assertEquals(0f, v[2], 0f);
        }
    }

    @Test
    public void testSizesStayWithinTierAndConfiguredRange() {
        // standard tier is 2..9, configured 2..8
        for (Particle p : assembler.assemble(grid(10, 10), 10, 10, ParticleGenerationConfig.standard(),
                new ScreenSize(640, 480))) {
            assertTrue(p.getSize() >= 2f && p.getSize() <= 8f, "size " + p.getSize());
        }

        // draft tier is 3..7, a disjoint configured range wins
        ParticleGenerationConfig big = ParticleGenerationConfig.draft().withParticleSizeRange(8f, 10f);
        for (Particle p : assembler.assemble(grid(10, 10), 10, 10, big, new ScreenSize(640, 480))) {
            assertTrue(p.getSize() >= 8f && p.getSize() <= 10f, "size " + p.getSize());
        }
    }

    @Test
    public void testEmptySamplesGiveNoParticles() {
        assertTrue(assembler.assemble(Collections.emptyList(), 10, 10, ParticleGenerationConfig.standard(),
                new ScreenSize(640, 480)).isEmpty());
    }

    @Test
    public void testInvalidScreenIsRejected() {
        assertThrows(AssemblyFailedException.class, () -> assembler.assemble(grid(2, 2), 2, 2,
                ParticleGenerationConfig.standard(), new ScreenSize(0, 480)));
    }
}
