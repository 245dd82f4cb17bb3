package com.pixelflow.server.sampling;

import com.pixelflow.server.generation.SamplingStrategyType;

import java.util.List;

public interface SamplingStrategy {

    SamplingStrategyType getType();

    /**
     * Returns exactly {@code min(targetCount, totalPixels)} distinct in-bounds
     * samples. {@code targetCount} is positive.
     */
    List<Sample> sample(SamplingContext context, int targetCount);
}
