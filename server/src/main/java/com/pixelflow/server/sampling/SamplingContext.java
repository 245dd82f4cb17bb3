package com.pixelflow.server.sampling;

import com.pixelflow.server.analysis.ImageAnalysis;
import com.pixelflow.server.generation.CancellationToken;
import com.pixelflow.server.generation.GenerationStage;
import com.pixelflow.server.image.PixelBuffer;

import java.util.Random;

/**
 * Inputs shared by every strategy for a single sampling run.
 */
public final class SamplingContext {

    private final PixelBuffer buffer;
    private final ImageAnalysis analysis;
    private final SamplingParams params;
    private final CancellationToken token;

    public SamplingContext(PixelBuffer buffer, ImageAnalysis analysis, SamplingParams params,
            CancellationToken token) {
        this.buffer = buffer;
        this.analysis = analysis;
        this.params = params;
        this.token = token;
    }

    public PixelBuffer getBuffer() {
        return buffer;
    }

    public ImageAnalysis getAnalysis() {
        return analysis;
    }

    public SamplingParams getParams() {
        return params;
    }

    public void checkCancelled() {
        token.throwIfCancelled(GenerationStage.SAMPLING);
    }

    /** Random source seeded from the image dimensions so repeated runs match. */
    public Random newRandom() {
        return new Random(0x5EEDL ^ (31L * buffer.getWidth() + buffer.getHeight()));
    }
}
