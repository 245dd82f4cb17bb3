package com.pixelflow.server.sampling;

import com.pixelflow.server.analysis.ImageAnalysis;
import com.pixelflow.server.analysis.ParallelImageAnalyzer;
import com.pixelflow.server.generation.SamplingStrategyType;
import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.image.PixelRegion;
import com.pixelflow.server.image.SyntheticImages;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AdaptiveSamplingStrategyTest {

    @Test
    public void testDensityFollowsEdges() {
        PixelBuffer buffer = SyntheticImages.flatLeftDetailedRight(64, 64);
        ImageAnalysis analysis = new ParallelImageAnalyzer().analyze(buffer);

        List<Sample> samples = new SamplingEngine().sample(analysis, buffer, 600, SamplingParams.defaults(),
                SamplingStrategyType.ADAPTIVE);

        SamplingAssertions.assertValidSampleSet(samples, buffer, 600);
        int left = SamplingAssertions.countLeftHalf(samples, 64);
        assertTrue(600 - left > 3 * left, "left=" + left);
        assertTrue(left > 0, "flat half starved");
    }

    @Test
    public void testTilesPartitionTheImage() {
        List<PixelRegion> tiles = AdaptiveSamplingStrategy.tiles(50, 3);
        assertEquals(8 * 3, tiles.size());
        long area = 0;
        for (PixelRegion tile : tiles) {
            assertFalse(tile.isEmpty());
            area += (long) tile.getWidth() * tile.getHeight();
        }
        assertEquals(150, area);
    }

    @Test
    public void testTileEdgeDensity() {
        PixelBuffer checker = SyntheticImages.checkerboard(8, 8, SyntheticImages.BLACK, SyntheticImages.WHITE);
        PixelBuffer flat = SyntheticImages.solid(8, 8, SyntheticImages.GRAY);
        // Only the bottom-right pixel has no neighbour to compare with
        assertEquals(63f / 64f, AdaptiveSamplingStrategy.tileEdgeDensity(checker, PixelRegion.full(8, 8)), 1e-6);
        assertEquals(0f, AdaptiveSamplingStrategy.tileEdgeDensity(flat, PixelRegion.full(8, 8)), 1e-6);
    }

    @Test
    public void testLargestRemainderAllocation() {
        int[] quotas = AdaptiveSamplingStrategy.allocate(8, new double[] { 1, 3 }, new long[] { 100, 100 });
        assertArrayEquals(new int[] { 2, 6 }, quotas);

        quotas = AdaptiveSamplingStrategy.allocate(10, new double[] { 1, 1, 1 }, new long[] { 100, 100, 100 });
        assertEquals(10, quotas[0] + quotas[1] + quotas[2]);
        assertArrayEquals(new int[] { 4, 3, 3 }, quotas);
    }

    @Test
    public void testAllocationRespectsTileCapacity() {
        int[] quotas = AdaptiveSamplingStrategy.allocate(10, new double[] { 1, 1 }, new long[] { 1, 100 });
        assertArrayEquals(new int[] { 1, 9 }, quotas);

        quotas = AdaptiveSamplingStrategy.allocate(10, new double[] { 1, 1 }, new long[] { 2, 3 });
        assertArrayEquals(new int[] { 2, 3 }, quotas);
    }
}
