package com.pixelflow.server.error;

import com.pixelflow.server.generation.GenerationStage;

/** Invalid target count or a buffer that does not match its analysis. */
public class SamplingFailedException extends PixelFlowException {

    public SamplingFailedException(String message) {
        super(GenerationStage.SAMPLING, message);
    }

    public SamplingFailedException(String message, Throwable cause) {
        super(GenerationStage.SAMPLING, message, cause);
    }
}
