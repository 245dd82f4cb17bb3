package com.pixelflow.server.image;

/**
 * Byte order of the four channels of a pixel inside a {@link PixelBuffer}.
 */
public enum ChannelOrder {
    RGBA(0, 1, 2, 3),
    BGRA(2, 1, 0, 3),
    ARGB(1, 2, 3, 0);

    private final int redOffset;
    private final int greenOffset;
    private final int blueOffset;
    private final int alphaOffset;

    ChannelOrder(int redOffset, int greenOffset, int blueOffset, int alphaOffset) {
        this.redOffset = redOffset;
        this.greenOffset = greenOffset;
        this.blueOffset = blueOffset;
        this.alphaOffset = alphaOffset;
    }

    public int getRedOffset() {
        return redOffset;
    }

    public int getGreenOffset() {
        return greenOffset;
    }

    public int getBlueOffset() {
        return blueOffset;
    }

    public int getAlphaOffset() {
        return alphaOffset;
    }
}
