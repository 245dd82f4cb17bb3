package com.pixelflow.server.analysis;

import com.pixelflow.server.generation.CancellationToken;
import com.pixelflow.server.image.PixelBuffer;

public interface ImageAnalyzer {

    /**
     * Computes the statistical descriptor of {@code buffer}.
     *
     * @throws com.pixelflow.server.error.AnalysisFailedException if the buffer has no colored pixels
     * @throws com.pixelflow.server.error.GenerationCancelledException if {@code token} is cancelled mid-scan
     */
    ImageAnalysis analyze(PixelBuffer buffer, CancellationToken token);

    default ImageAnalysis analyze(PixelBuffer buffer) {
        return analyze(buffer, CancellationToken.NONE);
    }
}
