package com.pixelflow.server.error;

import com.pixelflow.server.generation.GenerationStage;

public class AnalysisFailedException extends PixelFlowException {

    public AnalysisFailedException(String message) {
        super(GenerationStage.ANALYZING, message);
    }

    public AnalysisFailedException(String message, Throwable cause) {
        super(GenerationStage.ANALYZING, message, cause);
    }
}
