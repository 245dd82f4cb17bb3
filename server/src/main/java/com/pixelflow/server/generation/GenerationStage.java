package com.pixelflow.server.generation;

public enum GenerationStage {
    IDLE("Idle", false),
    STARTING("Starting", false),
    ANALYZING("Image Analysis", false),
    SAMPLING("Pixel Sampling", false),
    ASSEMBLING("Particle Assembly", false),
    COMPLETED("Completed", true),
    FAILED("Failed", true),
    CANCELLED("Cancelled", true),
    CACHE("Cache", false);

    private final String displayName;
    private final boolean terminal;

    GenerationStage(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
