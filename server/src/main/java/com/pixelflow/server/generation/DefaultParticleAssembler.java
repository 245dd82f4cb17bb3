package com.pixelflow.server.generation;

import com.pixelflow.server.error.AssemblyFailedException;
import com.pixelflow.server.sampling.Sample;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects samples into normalized device coordinates. Positions that fall
 * outside the screen in {@link ImageDisplayMode#FILL} are clamped to its edge,
 * so there is always exactly one particle per sample.
 */
public class DefaultParticleAssembler implements ParticleAssembler {

    static final float BASE_SPEED = 0.01f;
    static final double GOLDEN_ANGLE = Math.PI * (3 - Math.sqrt(5));
    static final int CHAOTIC_EVERY = 7;

    @Override
    public List<Particle> assemble(List<Sample> samples, int imageWidth, int imageHeight,
            ParticleGenerationConfig config, ScreenSize screenSize) {
        if (screenSize == null || !screenSize.isValid()) {
            throw new AssemblyFailedException("Invalid screen size: " + screenSize);
        }
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new AssemblyFailedException("Invalid image size " + imageWidth + "x" + imageHeight);
        }

        // 1. Half extents of the image in NDC
        float imageAspect = (float) imageWidth / imageHeight;
        float screenAspect = screenSize.getWidth() / screenSize.getHeight();
        boolean wider = imageAspect > screenAspect;
        boolean fit = config.getDisplayMode() == ImageDisplayMode.FIT;
        float halfWidth;
        float halfHeight;
        if (wider == fit) {
            halfWidth = 1f;
            halfHeight = screenAspect / imageAspect;
        } else {
            halfWidth = imageAspect / screenAspect;
            halfHeight = 1f;
        }

        // 2. Size range of the tier, narrowed to the configured bounds
        QualityPreset quality = config.getQualityPreset();
        float minSize = Math.max(quality.getMinSize(), config.getMinParticleSize());
        float maxSize = Math.min(quality.getMaxSize(), config.getMaxParticleSize());
        if (minSize > maxSize) {
            // Disjoint ranges, the configured bounds win
            minSize = config.getMinParticleSize();
            maxSize = Math.max(minSize, config.getMaxParticleSize());
        }

        float speed = BASE_SPEED * config.getParticleSpeed();
        List<Particle> particles = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            Sample s = samples.get(i);
            float nx = clamp(((s.getX() + 0.5f) / imageWidth * 2f - 1f) * halfWidth);
            float ny = clamp((1f - (s.getY() + 0.5f) / imageHeight * 2f) * halfHeight);
            float[] position = { nx, ny, 0f };

            double angle = i * GOLDEN_ANGLE;
            float[] velocity = { (float) Math.cos(angle) * speed, (float) Math.sin(angle) * speed, 0f };

            float size = minSize + (maxSize - minSize) * unitHash(i);
            float[] color = s.getColor().toArray();
            particles.add(new Particle(position, velocity, position, color, color, size, size, 0f,
                    i % CHAOTIC_EVERY == 0));
        }
        return particles;
    }

    private static float clamp(float v) {
        return Math.max(-1f, Math.min(1f, v));
    }

    /** Deterministic value in [0,1] for a particle index. */
    private static float unitHash(int i) {
        long h = (i * 2654435761L) & 0xFFFFL;
        return h / 65535f;
    }
}
