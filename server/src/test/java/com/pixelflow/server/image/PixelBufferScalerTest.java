package com.pixelflow.server.image;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PixelBufferScalerTest {

    @Test
    public void testSmallBufferIsReturnedAsIs() {
        PixelBuffer buffer = SyntheticImages.solid(10, 10, SyntheticImages.RED);
        Assertions.assertSame(buffer, PixelBufferScaler.downsampleIfNeeded(buffer, 2048));
    }

    @Test
    public void testLongSideIsCapped() {
        PixelBuffer buffer = SyntheticImages.solid(300, 30, SyntheticImages.BLUE);
        PixelBuffer scaled = PixelBufferScaler.downsampleIfNeeded(buffer, 100);

        Assertions.assertEquals(100, scaled.getWidth());
        Assertions.assertEquals(10, scaled.getHeight());
        Rgba c = scaled.colorAt(50, 5);
        Assertions.assertEquals(1f, c.getB(), 0.02);
        Assertions.assertEquals(0f, c.getR(), 0.02);
        Assertions.assertEquals(1f, c.getA(), 0.02);
    }

    @Test
    public void testTallImageKeepsAtLeastOnePixel() {
        PixelBuffer buffer = SyntheticImages.solid(1, 500, SyntheticImages.RED);
        PixelBuffer scaled = PixelBufferScaler.downsampleIfNeeded(buffer, 50);

        Assertions.assertEquals(1, scaled.getWidth());
        Assertions.assertEquals(50, scaled.getHeight());
    }
}
