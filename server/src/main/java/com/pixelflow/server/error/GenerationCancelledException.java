package com.pixelflow.server.error;

import com.pixelflow.server.generation.GenerationStage;

/**
 * Raised when a generation is aborted, either by the user or because another
 * generation is already running. Not an error condition.
 */
public class GenerationCancelledException extends PixelFlowException {

    public GenerationCancelledException(String message) {
        super(GenerationStage.CANCELLED, message);
    }

    public GenerationCancelledException(GenerationStage stage, String message) {
        super(stage, message);
    }
}
