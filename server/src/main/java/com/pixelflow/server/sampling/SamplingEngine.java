package com.pixelflow.server.sampling;

import com.pixelflow.server.analysis.ImageAnalysis;
import com.pixelflow.server.error.PixelFlowException;
import com.pixelflow.server.error.SamplingFailedException;
import com.pixelflow.server.generation.CancellationToken;
import com.pixelflow.server.generation.SamplingStrategyType;
import com.pixelflow.server.image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a sampling request and dispatches it to the strategy of the requested type.
 */
public class SamplingEngine {

    private static final Logger logger = LoggerFactory.getLogger(SamplingEngine.class);

    private final Map<SamplingStrategyType, SamplingStrategy> strategies = new EnumMap<>(SamplingStrategyType.class);

    public SamplingEngine() {
        register(new UniformSamplingStrategy());
        register(new ImportanceSamplingStrategy());
        register(new AdaptiveSamplingStrategy());
        register(new HybridSamplingStrategy());
    }

    public final void register(SamplingStrategy strategy) {
        strategies.put(strategy.getType(), strategy);
    }

    public List<Sample> sample(ImageAnalysis analysis, PixelBuffer buffer, int targetCount,
            SamplingParams params, SamplingStrategyType type) {
        return sample(analysis, buffer, targetCount, params, type, CancellationToken.NONE);
    }

    public List<Sample> sample(ImageAnalysis analysis, PixelBuffer buffer, int targetCount,
            SamplingParams params, SamplingStrategyType type, CancellationToken token) {
        // 1. Validate
        if (targetCount < 0) {
            throw new SamplingFailedException("Invalid target count: " + targetCount);
        }
        if (analysis.getWidth() != buffer.getWidth() || analysis.getHeight() != buffer.getHeight()) {
            throw new SamplingFailedException("Buffer " + buffer.getWidth() + "x" + buffer.getHeight()
                    + " does not match analysis " + analysis.getWidth() + "x" + analysis.getHeight());
        }
        if (targetCount == 0) {
            return Collections.emptyList();
        }
        SamplingStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new SamplingFailedException("No sampling strategy registered for " + type);
        }

        // 2. Sample
        long start = System.currentTimeMillis();
        List<Sample> samples;
        try {
            samples = strategy.sample(new SamplingContext(buffer, analysis, params, token), targetCount);
        } catch (PixelFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SamplingFailedException(type + " sampling failed: " + e.getMessage(), e);
        }

        // 3. Check the output contract
        for (Sample s : samples) {
            if (!buffer.contains(s.getX(), s.getY())) {
                throw new SamplingFailedException("Sample outside image: " + s);
            }
        }
        long expected = Math.min(targetCount, buffer.totalPixels());
        if (samples.size() != expected) {
            logger.warn("{} sampling produced {} samples, expected {}", type, samples.size(), expected);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("{} sampling produced {} samples in {} ms ({})", type, samples.size(),
                    System.currentTimeMillis() - start,
                    SampleSetDiagnostics.of(samples, buffer.getWidth(), buffer.getHeight()));
        }
        return samples;
    }
}
