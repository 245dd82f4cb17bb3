package com.pixelflow.server.generation;

import com.pixelflow.server.sampling.Sample;

import java.util.List;

public interface ParticleAssembler {

    /**
     * Maps samples taken from an {@code imageWidth} x {@code imageHeight} image
     * into screen-space particles, one per sample.
     *
     * @throws com.pixelflow.server.error.AssemblyFailedException on invalid input
     */
    List<Particle> assemble(List<Sample> samples, int imageWidth, int imageHeight,
            ParticleGenerationConfig config, ScreenSize screenSize);
}
