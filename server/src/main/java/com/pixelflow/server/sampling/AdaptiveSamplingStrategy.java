package com.pixelflow.server.sampling;

import com.pixelflow.server.generation.SamplingStrategyType;
import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.image.PixelRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the image into tiles and gives each tile a share of the budget
 * proportional to its edge density plus a floor, so flat tiles still get samples.
 */
public class AdaptiveSamplingStrategy implements SamplingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(AdaptiveSamplingStrategy.class);

    static final int TILES_PER_AXIS = 8;
    static final float BASE_WEIGHT = 0.25f;
    static final float GRADIENT_THRESHOLD = 0.15f;
    static final int MAX_PROBES_PER_AXIS = 64;

    @Override
    public SamplingStrategyType getType() {
        return SamplingStrategyType.ADAPTIVE;
    }

    @Override
    public List<Sample> sample(SamplingContext context, int targetCount) {
        PixelBuffer buffer = context.getBuffer();
        if (targetCount >= buffer.totalPixels()) {
            return UniformSamplingStrategy.fullCoverage(context);
        }

        // 1. Tiles and their weights
        List<PixelRegion> tiles = tiles(buffer.getWidth(), buffer.getHeight());
        double[] weights = new double[tiles.size()];
        for (int i = 0; i < tiles.size(); i++) {
            context.checkCancelled();
            weights[i] = BASE_WEIGHT + tileEdgeDensity(buffer, tiles.get(i));
        }

        // 2. Budget per tile
        long[] capacities = new long[tiles.size()];
        for (int i = 0; i < tiles.size(); i++) {
            capacities[i] = (long) tiles.get(i).getWidth() * tiles.get(i).getHeight();
        }
        int[] quotas = allocate(targetCount, weights, capacities);

        // 3. Per-tile importance selection, falling back to a tile-local grid
        ImportanceScorer scorer = new ImportanceScorer(context.getParams(),
                context.getAnalysis().getDominantColors());
        SampleSetBuilder builder = new SampleSetBuilder(buffer, targetCount);
        for (int i = 0; i < tiles.size(); i++) {
            if (quotas[i] == 0) {
                continue;
            }
            PixelRegion tile = tiles.get(i);
            int stride = Math.max(1, Math.max(tile.getWidth(), tile.getHeight()) / MAX_PROBES_PER_AXIS);
            List<Candidate> candidates = scorer.scan(context, tile, stride, 0f);
            if (context.getParams().isApplyAntiClustering()) {
                candidates = AntiClusteringFilter.filter(candidates, capacities[i], quotas[i]);
            }
            candidates.sort(Candidate.BY_SCORE_DESC);

            int goal = builder.size() + quotas[i];
            builder.addAll(candidates, goal);
            if (builder.size() < goal) {
                for (int[] p : UniformSamplingStrategy.gridPositions(tile.getWidth(), tile.getHeight(),
                        goal - builder.size())) {
                    builder.add(tile.getX() + p[0], tile.getY() + p[1]);
                }
            }
        }
        if (!builder.isFull()) {
            logger.debug("Adaptive tiles left {} slots, filling uniformly", builder.remaining());
        }
        builder.fillUniformGrid(context);
        builder.topUp(context);
        return builder.build();
    }

    static List<PixelRegion> tiles(int width, int height) {
        int tilesX = Math.min(TILES_PER_AXIS, width);
        int tilesY = Math.min(TILES_PER_AXIS, height);
        List<PixelRegion> tiles = new ArrayList<>(tilesX * tilesY);
        for (int ty = 0; ty < tilesY; ty++) {
            int y0 = ty * height / tilesY;
            int y1 = (ty + 1) * height / tilesY;
            for (int tx = 0; tx < tilesX; tx++) {
                int x0 = tx * width / tilesX;
                int x1 = (tx + 1) * width / tilesX;
                tiles.add(new PixelRegion(x0, y0, x1 - x0, y1 - y0));
            }
        }
        return tiles;
    }

    /**
     * Fraction of probed pixels whose horizontal or vertical brightness step
     * exceeds the gradient threshold.
     */
    static float tileEdgeDensity(PixelBuffer buffer, PixelRegion tile) {
        int stride = Math.max(1, Math.max(tile.getWidth(), tile.getHeight()) / MAX_PROBES_PER_AXIS);
        int probes = 0;
        int edges = 0;
        for (int y = tile.getY(); y < tile.getY() + tile.getHeight(); y += stride) {
            for (int x = tile.getX(); x < tile.getX() + tile.getWidth(); x += stride) {
                float b = brightness(buffer.packedArgbAt(x, y));
                float dx = x + 1 < buffer.getWidth() ? Math.abs(brightness(buffer.packedArgbAt(x + 1, y)) - b) : 0f;
                float dy = y + 1 < buffer.getHeight() ? Math.abs(brightness(buffer.packedArgbAt(x, y + 1)) - b) : 0f;
                if (dx > GRADIENT_THRESHOLD || dy > GRADIENT_THRESHOLD) {
                    edges++;
                }
                probes++;
            }
        }
        return probes == 0 ? 0f : (float) edges / probes;
    }

    /**
     * Largest-remainder apportionment of {@code total} by {@code weights},
     * no tile receiving more than its pixel count.
     */
    static int[] allocate(int total, double[] weights, long[] capacities) {
        int n = weights.length;
        int[] quotas = new int[n];
        double weightSum = 0;
        for (double w : weights) {
            weightSum += w;
        }
        if (weightSum <= 0) {
            return quotas;
        }
        double[] remainders = new double[n];
        int assigned = 0;
        for (int i = 0; i < n; i++) {
            double exact = total * weights[i] / weightSum;
            quotas[i] = (int) Math.min(capacities[i], (long) Math.floor(exact));
            remainders[i] = exact - Math.floor(exact);
            assigned += quotas[i];
        }
        while (assigned < total) {
            int best = -1;
            for (int i = 0; i < n; i++) {
                if (quotas[i] < capacities[i] && (best < 0 || remainders[i] > remainders[best])) {
                    best = i;
                }
            }
            if (best < 0) {
                break;
            }
            quotas[best]++;
            remainders[best] = -1;
            assigned++;
            boolean anyLeft = false;
            for (int i = 0; i < n; i++) {
                if (remainders[i] >= 0 && quotas[i] < capacities[i]) {
                    anyLeft = true;
                    break;
                }
            }
            if (!anyLeft) {
                // Every tile took its rounding share, spread the rest by weight again
                for (int i = 0; i < n; i++) {
                    remainders[i] = weights[i];
                }
            }
        }
        return quotas;
    }

    private static float brightness(int argb) {
        return ((((argb >> 16) & 0xFF) + ((argb >> 8) & 0xFF) + (argb & 0xFF)) / 3f) / 255f;
    }
}
