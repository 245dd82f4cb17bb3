package com.pixelflow.server.image;

import java.util.Arrays;
import java.util.Random;

/**
 * Small synthetic images shared by the tests.
 */
public final class SyntheticImages {

    public static final int BLACK = 0xFF000000;
    public static final int WHITE = 0xFFFFFFFF;
    public static final int GRAY = 0xFF808080;
    public static final int RED = 0xFFFF0000;
    public static final int BLUE = 0xFF0000FF;
    public static final int YELLOW = 0xFFFFFF00;
    public static final int TRANSPARENT = 0x00000000;

    private SyntheticImages() {
    }

    public static PixelBuffer checkerboard(int width, int height, int a, int b) {
        int[] argb = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                argb[y * width + x] = ((x + y) % 2 == 0) ? a : b;
            }
        }
        return PixelBuffer.fromArgbPixels(width, height, argb);
    }

    public static PixelBuffer solid(int width, int height, int color) {
        int[] argb = new int[width * height];
        Arrays.fill(argb, color);
        return PixelBuffer.fromArgbPixels(width, height, argb);
    }

    /** Flat gray left half, red/yellow checker right half. */
    public static PixelBuffer flatLeftDetailedRight(int width, int height) {
        int[] argb = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (x < width / 2) {
                    argb[y * width + x] = GRAY;
                } else {
                    argb[y * width + x] = ((x + y) % 2 == 0) ? RED : YELLOW;
                }
            }
        }
        return PixelBuffer.fromArgbPixels(width, height, argb);
    }

    public static PixelBuffer random(int width, int height, long seed) {
        Random random = new Random(seed);
        int[] argb = new int[width * height];
        for (int i = 0; i < argb.length; i++) {
            argb[i] = random.nextInt();
        }
        // at least one clearly visible pixel
        argb[0] = RED;
        return PixelBuffer.fromArgbPixels(width, height, argb);
    }
}
