package com.pixelflow.server.sampling;

import com.pixelflow.server.image.Rgba;

import java.util.Objects;

/**
 * One chosen pixel and its colour.
 */
public final class Sample {

    private final int x;
    private final int y;
    private final Rgba color;

    public Sample(int x, int y, Rgba color) {
        this.x = x;
        this.y = y;
        this.color = color;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public Rgba getColor() {
        return color;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sample)) {
            return false;
        }
        Sample other = (Sample) o;
        return x == other.x && y == other.y && color.equals(other.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, color);
    }

    @Override
    public String toString() {
        return "Sample(" + x + ", " + y + ", " + color + ")";
    }
}
