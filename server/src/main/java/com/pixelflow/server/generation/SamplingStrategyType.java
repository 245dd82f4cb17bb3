package com.pixelflow.server.generation;

public enum SamplingStrategyType {
    UNIFORM,
    IMPORTANCE,
    ADAPTIVE,
    HYBRID;

    public static SamplingStrategyType fromName(String name) {
        for (SamplingStrategyType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown sampling strategy: " + name);
    }
}
