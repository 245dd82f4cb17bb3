package com.pixelflow.server.error;

import com.pixelflow.server.generation.GenerationStage;

/** Zero or negative dimensions, or a buffer that cannot be read. */
public class InvalidImageException extends PixelFlowException {

    public InvalidImageException(String message) {
        super(GenerationStage.ANALYZING, message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super(GenerationStage.ANALYZING, message, cause);
    }
}
