package com.pixelflow.server.image;

import com.pixelflow.server.error.InvalidImageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Decoded 4-byte-per-pixel image. The byte array is owned by the buffer and
 * never written after construction, so every read method is safe to call from
 * any number of threads without locking.
 */
public final class PixelBuffer {

    private static final Logger logger = LoggerFactory.getLogger(PixelBuffer.class);

    public static final int BYTES_PER_PIXEL = 4;
    public static final float TRANSPARENT_ALPHA = 0.1f;

    private static final int OPAQUE_BLACK_ARGB = 0xFF000000;
    private static final int VALIDATION_SPOT_CHECKS = 8;

    private final int width;
    private final int height;
    private final int strideBytes;
    private final ChannelOrder channelOrder;
    private final byte[] bytes;

    /**
     * Takes ownership of {@code bytes}; callers must not modify the array afterwards.
     */
    public PixelBuffer(int width, int height, int strideBytes, ChannelOrder channelOrder, byte[] bytes) {
        if (width <= 0 || height <= 0) {
            throw new InvalidImageException("Invalid image dimensions " + width + "x" + height);
        }
        if (strideBytes <= 0) {
            throw new InvalidImageException("Invalid stride " + strideBytes);
        }
        if (channelOrder == null || bytes == null) {
            throw new InvalidImageException("Pixel data and channel order are required");
        }
        this.width = width;
        this.height = height;
        this.strideBytes = strideBytes;
        this.channelOrder = channelOrder;
        this.bytes = bytes;
    }

    public static PixelBuffer fromArgbPixels(int width, int height, int[] argb) {
        if (argb == null || argb.length < (long) width * height) {
            throw new InvalidImageException("Expected " + ((long) width * height) + " ARGB pixels");
        }
        if ((long) width * height * BYTES_PER_PIXEL > Integer.MAX_VALUE) {
            throw new InvalidImageException("Image " + width + "x" + height + " is too large");
        }
        byte[] data = new byte[width * height * BYTES_PER_PIXEL];
        for (int i = 0; i < width * height; i++) {
            int p = argb[i];
            int o = i * BYTES_PER_PIXEL;
            data[o] = (byte) (p >>> 24);
            data[o + 1] = (byte) (p >>> 16);
            data[o + 2] = (byte) (p >>> 8);
            data[o + 3] = (byte) p;
        }
        return new PixelBuffer(width, height, width * BYTES_PER_PIXEL, ChannelOrder.ARGB, data);
    }

    public static PixelBuffer fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        return fromArgbPixels(w, h, argb);
    }

    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                row[x] = packedArgbAt(x, y);
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getStrideBytes() {
        return strideBytes;
    }

    public ChannelOrder getChannelOrder() {
        return channelOrder;
    }

    public long totalPixels() {
        return (long) width * height;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /**
     * Pixel as packed ARGB. A byte offset past the end of the data yields
     * opaque black instead of failing, a short buffer is a recoverable input defect.
     */
    public int packedArgbAt(int x, int y) {
        checkCoordinate(x, y);
        long offset = (long) y * strideBytes + (long) x * BYTES_PER_PIXEL;
        if (offset + BYTES_PER_PIXEL > bytes.length) {
            return OPAQUE_BLACK_ARGB;
        }
        int o = (int) offset;
        int r = bytes[o + channelOrder.getRedOffset()] & 0xFF;
        int g = bytes[o + channelOrder.getGreenOffset()] & 0xFF;
        int b = bytes[o + channelOrder.getBlueOffset()] & 0xFF;
        int a = bytes[o + channelOrder.getAlphaOffset()] & 0xFF;
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    public Rgba colorAt(int x, int y) {
        return Rgba.fromPackedArgb(packedArgbAt(x, y));
    }

    /**
     * Raw channel bytes in canonical RGBA order, empty when the coordinate or
     * the computed offset is outside the buffer.
     */
    public Optional<byte[]> rawColorAt(int x, int y) {
        if (!contains(x, y)) {
            return Optional.empty();
        }
        long offset = (long) y * strideBytes + (long) x * BYTES_PER_PIXEL;
        if (offset + BYTES_PER_PIXEL > bytes.length) {
            return Optional.empty();
        }
        int o = (int) offset;
        return Optional.of(new byte[] {
                bytes[o + channelOrder.getRedOffset()],
                bytes[o + channelOrder.getGreenOffset()],
                bytes[o + channelOrder.getBlueOffset()],
                bytes[o + channelOrder.getAlphaOffset()]
        });
    }

    public float brightnessAt(int x, int y) {
        return colorAt(x, y).luma();
    }

    public float saturationAt(int x, int y) {
        return colorAt(x, y).saturation();
    }

    public boolean isTransparentAt(int x, int y) {
        return colorAt(x, y).getA() < TRANSPARENT_ALPHA;
    }

    /**
     * Colours of the pixels within {@code radius} of (x, y), excluding the
     * centre, clipped to the buffer.
     */
    public List<Rgba> neighbors(int x, int y, int radius) {
        List<Rgba> result = new ArrayList<>();
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                if (dx == 0 && dy == 0) {
                    continue;
                }
                int nx = x + dx;
                int ny = y + dy;
                if (contains(nx, ny)) {
                    result.add(colorAt(nx, ny));
                }
            }
        }
        return result;
    }

    /**
     * Lazily sampled colours of {@code region} on a {@code step} grid, clipped to the buffer.
     */
    public Stream<Rgba> colorsInRegion(PixelRegion region, int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        PixelRegion clipped = region.clipTo(width, height);
        if (clipped.isEmpty()) {
            return Stream.empty();
        }
        int cols = (clipped.getWidth() + step - 1) / step;
        int rows = (clipped.getHeight() + step - 1) / step;
        return IntStream.range(0, rows).boxed()
                .flatMap(r -> IntStream.range(0, cols).mapToObj(c -> colorAt(
                        clipped.getX() + c * step,
                        clipped.getY() + r * step)));
    }

    public Rgba averageColor(PixelRegion region) {
        float[] sums = new float[4];
        long[] count = new long[1];
        colorsInRegion(region, 1).forEach(c -> {
            sums[0] += c.getR();
            sums[1] += c.getG();
            sums[2] += c.getB();
            sums[3] += c.getA();
            count[0]++;
        });
        if (count[0] == 0) {
            return Rgba.OPAQUE_BLACK;
        }
        return new Rgba(sums[0] / count[0], sums[1] / count[0], sums[2] / count[0], sums[3] / count[0]);
    }

    /**
     * Cheap structural health check. Returns false instead of throwing.
     */
    public boolean validate() {
        if (strideBytes < width * BYTES_PER_PIXEL) {
            logger.warn("Stride {} is smaller than a row of {} pixels", strideBytes, width);
            return false;
        }
        long required = (long) (height - 1) * strideBytes + (long) width * BYTES_PER_PIXEL;
        if (bytes.length < required) {
            logger.warn("Pixel data holds {} bytes, {} required for {}x{}", bytes.length, required, width, height);
            return false;
        }
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < VALIDATION_SPOT_CHECKS; i++) {
            Rgba c = colorAt(random.nextInt(width), random.nextInt(height));
            if (!inUnitRange(c.getR()) || !inUnitRange(c.getG()) || !inUnitRange(c.getB())
                    || !inUnitRange(c.getA())) {
                logger.warn("Pixel value out of range: {}", c);
                return false;
            }
        }
        return true;
    }

    private static boolean inUnitRange(float v) {
        return v >= 0f && v <= 1f;
    }

    private void checkCoordinate(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + "x" + height);
        }
    }
}
