package com.pixelflow.server.error;

import com.pixelflow.server.generation.GenerationStage;

/** Serialization or I/O failure inside the result cache. */
public class CacheException extends PixelFlowException {

    public CacheException(String message) {
        super(GenerationStage.CACHE, message);
    }

    public CacheException(String message, Throwable cause) {
        super(GenerationStage.CACHE, message, cause);
    }
}
