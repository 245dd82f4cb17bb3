package com.pixelflow.server.generation;

import java.util.Arrays;

/**
 * Renderer-facing particle.
 */
public final class Particle {

    public static final int FLOAT_FIELDS = 21;

    private final float[] position;
    private final float[] velocity;
    private final float[] targetPosition;
    private final float[] color;
    private final float[] originalColor;
    private final float size;
    private final float baseSize;
    private final float life;
    private final boolean idleChaoticMotion;

    public Particle(float[] position, float[] velocity, float[] targetPosition, float[] color,
            float[] originalColor, float size, float baseSize, float life, boolean idleChaoticMotion) {
        this.position = checkLength(position, 3, "position");
        this.velocity = checkLength(velocity, 3, "velocity");
        this.targetPosition = checkLength(targetPosition, 3, "targetPosition");
        this.color = checkLength(color, 4, "color");
        this.originalColor = checkLength(originalColor, 4, "originalColor");
        this.size = size;
        this.baseSize = baseSize;
        this.life = life;
        this.idleChaoticMotion = idleChaoticMotion;
    }

    private static float[] checkLength(float[] values, int length, String name) {
        if (values == null || values.length != length) {
            throw new IllegalArgumentException(name + " must have " + length + " components");
        }
        return values.clone();
    }

    public float[] getPosition() {
        return position.clone();
    }

    public float[] getVelocity() {
        return velocity.clone();
    }

    public float[] getTargetPosition() {
        return targetPosition.clone();
    }

    public float[] getColor() {
        return color.clone();
    }

    public float[] getOriginalColor() {
        return originalColor.clone();
    }

    public float getSize() {
        return size;
    }

    public float getBaseSize() {
        return baseSize;
    }

    public float getLife() {
        return life;
    }

    public boolean isIdleChaoticMotion() {
        return idleChaoticMotion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Particle)) {
            return false;
        }
        Particle other = (Particle) o;
        return Float.compare(size, other.size) == 0
                && Float.compare(baseSize, other.baseSize) == 0
                && Float.compare(life, other.life) == 0
                && idleChaoticMotion == other.idleChaoticMotion
                && Arrays.equals(position, other.position)
                && Arrays.equals(velocity, other.velocity)
                && Arrays.equals(targetPosition, other.targetPosition)
                && Arrays.equals(color, other.color)
                && Arrays.equals(originalColor, other.originalColor);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(position);
        result = 31 * result + Arrays.hashCode(color);
        result = 31 * result + Float.hashCode(size);
        return result;
    }
}
