package com.pixelflow.server.image;

import com.pixelflow.server.error.InvalidImageException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public class PixelBufferTest {

    @Test
    public void testChannelOrderTranslation() {
        // r=255 g=128 b=0 a=64 in each layout
        PixelBuffer rgba = new PixelBuffer(1, 1, 4, ChannelOrder.RGBA, new byte[] { (byte) 255, (byte) 128, 0, 64 });
        PixelBuffer bgra = new PixelBuffer(1, 1, 4, ChannelOrder.BGRA, new byte[] { 0, (byte) 128, (byte) 255, 64 });
        PixelBuffer argb = new PixelBuffer(1, 1, 4, ChannelOrder.ARGB, new byte[] { 64, (byte) 255, (byte) 128, 0 });

        Rgba expected = new Rgba(1f, 128 / 255f, 0f, 64 / 255f);
        Assertions.assertEquals(expected, rgba.colorAt(0, 0));
        Assertions.assertEquals(expected, bgra.colorAt(0, 0));
        Assertions.assertEquals(expected, argb.colorAt(0, 0));
        Assertions.assertArrayEquals(new byte[] { (byte) 255, (byte) 128, 0, 64 }, bgra.rawColorAt(0, 0).get());
    }

    @Test
    public void testStridePadding() {
        // 2x2 image, 4 bytes of padding per row
        byte[] bytes = new byte[12 * 2];
        bytes[12 + 4] = (byte) 255; // (1,1) red
        bytes[12 + 7] = (byte) 255;
        PixelBuffer buffer = new PixelBuffer(2, 2, 12, ChannelOrder.RGBA, bytes);

        Assertions.assertTrue(buffer.validate());
        Assertions.assertEquals(new Rgba(1f, 0f, 0f, 1f), buffer.colorAt(1, 1));
        Assertions.assertEquals(new Rgba(0f, 0f, 0f, 0f), buffer.colorAt(0, 1));
    }

    @Test
    public void testShortBufferDegradesToOpaqueBlack() {
        // Room for three of the four pixels
        byte[] bytes = new byte[12];
        java.util.Arrays.fill(bytes, (byte) 255);
        PixelBuffer buffer = new PixelBuffer(2, 2, 8, ChannelOrder.RGBA, bytes);

        Assertions.assertFalse(buffer.validate());
        Assertions.assertEquals(new Rgba(1f, 1f, 1f, 1f), buffer.colorAt(0, 1));
        Assertions.assertEquals(Rgba.OPAQUE_BLACK, buffer.colorAt(1, 1));
        Assertions.assertTrue(buffer.rawColorAt(1, 1).isEmpty());
    }

    @Test
    public void testStrideSmallerThanRowFailsValidation() {
        PixelBuffer buffer = new PixelBuffer(4, 1, 8, ChannelOrder.RGBA, new byte[64]);
        Assertions.assertFalse(buffer.validate());
    }

    @Test
    public void testInvalidDimensionsRejected() {
        Assertions.assertThrows(InvalidImageException.class,
                () -> new PixelBuffer(0, 5, 4, ChannelOrder.RGBA, new byte[20]));
        Assertions.assertThrows(InvalidImageException.class,
                () -> new PixelBuffer(5, -1, 20, ChannelOrder.RGBA, new byte[20]));
        Assertions.assertThrows(InvalidImageException.class,
                () -> PixelBuffer.fromArgbPixels(3, 3, new int[4]));
    }

    @Test
    public void testOutOfRangeCoordinate() {
        PixelBuffer buffer = SyntheticImages.solid(3, 3, SyntheticImages.RED);
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> buffer.colorAt(3, 0));
        Assertions.assertTrue(buffer.rawColorAt(-1, 0).isEmpty());
    }

    @Test
    public void testRegionIsClippedAndStrided() {
        PixelBuffer buffer = SyntheticImages.checkerboard(4, 4, SyntheticImages.BLACK, SyntheticImages.WHITE);

        Assertions.assertEquals(4, buffer.colorsInRegion(new PixelRegion(2, 2, 10, 10), 1).count());
        Assertions.assertEquals(4, buffer.colorsInRegion(PixelRegion.full(4, 4), 2).count());
        Assertions.assertEquals(0, buffer.colorsInRegion(new PixelRegion(8, 8, 2, 2), 1).count());

        // Step 2 from the origin only visits (x+y) even cells, all black
        List<Rgba> strided = buffer.colorsInRegion(PixelRegion.full(4, 4), 2).collect(Collectors.toList());
        for (Rgba c : strided) {
            Assertions.assertEquals(Rgba.OPAQUE_BLACK, c);
        }
    }

    @Test
    public void testAverageColor() {
        PixelBuffer buffer = SyntheticImages.checkerboard(4, 4, SyntheticImages.BLACK, SyntheticImages.WHITE);
        Rgba avg = buffer.averageColor(PixelRegion.full(4, 4));
        Assertions.assertEquals(0.5f, avg.getR(), 1e-6);
        Assertions.assertEquals(0.5f, avg.getG(), 1e-6);
        Assertions.assertEquals(0.5f, avg.getB(), 1e-6);
        Assertions.assertEquals(1f, avg.getA(), 1e-6);

        Assertions.assertEquals(Rgba.OPAQUE_BLACK, buffer.averageColor(new PixelRegion(10, 10, 1, 1)));
    }

    @Test
    public void testNeighborsAndDerivedValues() {
        PixelBuffer buffer = SyntheticImages.solid(3, 3, SyntheticImages.RED);
        Assertions.assertEquals(8, buffer.neighbors(1, 1, 1).size());
        Assertions.assertEquals(3, buffer.neighbors(0, 0, 1).size());
        Assertions.assertEquals(1f, buffer.saturationAt(0, 0), 1e-6);
        Assertions.assertEquals(0.299f, buffer.brightnessAt(0, 0), 1e-6);
        Assertions.assertFalse(buffer.isTransparentAt(0, 0));
        Assertions.assertTrue(SyntheticImages.solid(1, 1, SyntheticImages.TRANSPARENT).isTransparentAt(0, 0));
    }

    @Test
    public void testConcurrentReadsAreDeterministic() {
        PixelBuffer buffer = SyntheticImages.random(64, 64, 7L);
        int[] expected = new int[64 * 64];
        for (int i = 0; i < expected.length; i++) {
            expected[i] = buffer.packedArgbAt(i % 64, i / 64);
        }
        ConcurrentLinkedQueue<Integer> mismatches = new ConcurrentLinkedQueue<>();
        IntStream.range(0, expected.length * 8).parallel().forEach(i -> {
            int p = i % expected.length;
            if (buffer.packedArgbAt(p % 64, p / 64) != expected[p]) {
                mismatches.add(p);
            }
        });
        Assertions.assertTrue(mismatches.isEmpty());
    }

    @Test
    public void testBufferedImageRoundTrip() {
        PixelBuffer buffer = SyntheticImages.random(5, 4, 3L);
        PixelBuffer copy = PixelBuffer.fromBufferedImage(buffer.toBufferedImage());
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 5; x++) {
                Assertions.assertEquals(buffer.colorAt(x, y), copy.colorAt(x, y));
            }
        }
    }
}
