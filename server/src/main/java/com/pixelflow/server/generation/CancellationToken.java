package com.pixelflow.server.generation;

import com.pixelflow.server.error.GenerationCancelledException;

/**
 * Cooperative cancellation flag shared between the coordinator and the stages it runs.
 */
public final class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this != NONE) {
            cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled(GenerationStage stage) {
        if (cancelled) {
            throw new GenerationCancelledException(stage, "Generation cancelled during " + stage.getDisplayName());
        }
    }
}
