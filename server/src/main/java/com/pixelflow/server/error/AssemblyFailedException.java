package com.pixelflow.server.error;

import com.pixelflow.server.generation.GenerationStage;

public class AssemblyFailedException extends PixelFlowException {

    public AssemblyFailedException(String message) {
        super(GenerationStage.ASSEMBLING, message);
    }

    public AssemblyFailedException(String message, Throwable cause) {
        super(GenerationStage.ASSEMBLING, message, cause);
    }
}
