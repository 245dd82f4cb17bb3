package com.pixelflow.server.generation;

/**
 * Receives stage progress. May be called from any thread.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (progress, stageName) -> {
    };

    void onProgress(float progress, String stageName);
}
