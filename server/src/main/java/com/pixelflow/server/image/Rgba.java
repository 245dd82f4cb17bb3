package com.pixelflow.server.image;

import java.util.Arrays;

/**
 * Canonical straight-alpha colour with components in [0,1].
 */
public final class Rgba {

    public static final Rgba OPAQUE_BLACK = new Rgba(0f, 0f, 0f, 1f);

    private final float r;
    private final float g;
    private final float b;
    private final float a;

    public Rgba(float r, float g, float b, float a) {
        this.r = r;
        this.g = g;
        this.b = b;
        this.a = a;
    }

    public static Rgba fromPackedArgb(int argb) {
        return new Rgba(
                ((argb >> 16) & 0xFF) / 255f,
                ((argb >> 8) & 0xFF) / 255f,
                (argb & 0xFF) / 255f,
                ((argb >>> 24) & 0xFF) / 255f);
    }

    public float getR() {
        return r;
    }

    public float getG() {
        return g;
    }

    public float getB() {
        return b;
    }

    public float getA() {
        return a;
    }

    /** Mean of the three colour channels. */
    public float brightness() {
        return (r + g + b) / 3f;
    }

    /** BT.601 luma. */
    public float luma() {
        return 0.299f * r + 0.587f * g + 0.114f * b;
    }

    public float saturation() {
        float max = Math.max(r, Math.max(g, b));
        if (max <= 0f) {
            return 0f;
        }
        float min = Math.min(r, Math.min(g, b));
        return (max - min) / max;
    }

    public float distanceTo(Rgba other) {
        float dr = r - other.r;
        float dg = g - other.g;
        float db = b - other.b;
        return (float) Math.sqrt(dr * dr + dg * dg + db * db);
    }

    public float[] toArray() {
        return new float[] { r, g, b, a };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rgba)) {
            return false;
        }
        Rgba other = (Rgba) o;
        return Float.compare(r, other.r) == 0
                && Float.compare(g, other.g) == 0
                && Float.compare(b, other.b) == 0
                && Float.compare(a, other.a) == 0;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return String.format("Rgba(%.3f, %.3f, %.3f, %.3f)", r, g, b, a);
    }
}
