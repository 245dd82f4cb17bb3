package com.pixelflow.server.generation;

public final class ScreenSize {

    private final float width;
    private final float height;

    public ScreenSize(float width, float height) {
        this.width = width;
        this.height = height;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }

    public boolean isValid() {
        return width > 0 && height > 0;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
