package com.pixelflow.server.error;

import com.pixelflow.server.generation.GenerationStage;

/**
 * Root of the generation pipeline failures. Every subtype names the stage it
 * originated from.
 */
public abstract class PixelFlowException extends RuntimeException {

    private final GenerationStage stage;

    protected PixelFlowException(GenerationStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected PixelFlowException(GenerationStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public GenerationStage getStage() {
        return stage;
    }
}
