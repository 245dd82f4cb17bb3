package com.pixelflow.server.generation;

/**
 * Consistent snapshot of the coordinator's state.
 */
public final class GenerationState {

    public static final GenerationState IDLE = new GenerationState(false, 0f, GenerationStage.IDLE);

    private final boolean generating;
    private final float progress;
    private final GenerationStage stage;

    public GenerationState(boolean generating, float progress, GenerationStage stage) {
        this.generating = generating;
        this.progress = progress;
        this.stage = stage;
    }

    public boolean isGenerating() {
        return generating;
    }

    public float getProgress() {
        return progress;
    }

    public GenerationStage getStage() {
        return stage;
    }

    @Override
    public String toString() {
        return "GenerationState{generating=" + generating + ", progress=" + progress + ", stage=" + stage + "}";
    }
}
