package com.pixelflow.server.image;

/**
 * Axis-aligned pixel rectangle. Width and height may extend past a buffer,
 * callers clip with {@link #clipTo(int, int)}.
 */
public final class PixelRegion {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public PixelRegion(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = Math.max(0, width);
        this.height = Math.max(0, height);
    }

    public static PixelRegion full(int width, int height) {
        return new PixelRegion(0, 0, width, height);
    }

    public PixelRegion clipTo(int bufferWidth, int bufferHeight) {
        int x0 = Math.max(0, x);
        int y0 = Math.max(0, y);
        int x1 = Math.min(bufferWidth, x + width);
        int y1 = Math.min(bufferHeight, y + height);
        return new PixelRegion(x0, y0, x1 - x0, y1 - y0);
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "PixelRegion[" + x + "," + y + " " + width + "x" + height + "]";
    }
}
