package com.pixelflow.server.analysis;

import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.image.Rgba;

/**
 * Partial sums of one scanned row. Rows are scanned independently and merged
 * afterwards in row order, which keeps the histogram's first-seen ordering
 * identical to a sequential scan.
 */
final class RowStatistics {

    static final int LEVELS = 9;
    static final int BUCKETS = LEVELS * LEVELS * LEVELS;
    static final float ALPHA_THRESHOLD = 0.1f;
    static final float EDGE_THRESHOLD = 0.15f;

    double sumR;
    double sumG;
    double sumB;
    double sumSaturation;
    float minBrightness = Float.MAX_VALUE;
    float maxBrightness = -Float.MAX_VALUE;
    long coloredPixels;
    long edgePixels;

    final int[] bucketCounts = new int[BUCKETS];
    final int[] bucketOrder = new int[BUCKETS];
    int bucketOrderSize;

    static RowStatistics scan(PixelBuffer buffer, int y) {
        RowStatistics row = new RowStatistics();
        float previousBrightness = Float.NaN;
        for (int x = 0; x < buffer.getWidth(); x++) {
            int argb = buffer.packedArgbAt(x, y);
            float a = ((argb >>> 24) & 0xFF) / 255f;
            if (a <= ALPHA_THRESHOLD) {
                continue;
            }
            float r = ((argb >> 16) & 0xFF) / 255f;
            float g = ((argb >> 8) & 0xFF) / 255f;
            float b = (argb & 0xFF) / 255f;

            row.sumR += r * a;
            row.sumG += g * a;
            row.sumB += b * a;

            float brightness = (r + g + b) / 3f;
            row.minBrightness = Math.min(row.minBrightness, brightness);
            row.maxBrightness = Math.max(row.maxBrightness, brightness);

            float max = Math.max(r, Math.max(g, b));
            float min = Math.min(r, Math.min(g, b));
            if (max > 0f) {
                row.sumSaturation += (max - min) / max;
            }

            if (!Float.isNaN(previousBrightness) && Math.abs(brightness - previousBrightness) > EDGE_THRESHOLD) {
                row.edgePixels++;
            }
            previousBrightness = brightness;

            row.addToBucket(bucketKey(r, g, b), 1);
            row.coloredPixels++;
        }
        return row;
    }

    void merge(RowStatistics other) {
        sumR += other.sumR;
        sumG += other.sumG;
        sumB += other.sumB;
        sumSaturation += other.sumSaturation;
        minBrightness = Math.min(minBrightness, other.minBrightness);
        maxBrightness = Math.max(maxBrightness, other.maxBrightness);
        coloredPixels += other.coloredPixels;
        edgePixels += other.edgePixels;
        for (int i = 0; i < other.bucketOrderSize; i++) {
            int key = other.bucketOrder[i];
            addToBucket(key, other.bucketCounts[key]);
        }
    }

    private void addToBucket(int key, int count) {
        if (bucketCounts[key] == 0) {
            bucketOrder[bucketOrderSize++] = key;
        }
        bucketCounts[key] += count;
    }

    static int bucketKey(float r, float g, float b) {
        return quantize(r) * LEVELS * LEVELS + quantize(g) * LEVELS + quantize(b);
    }

    private static int quantize(float c) {
        return Math.round(c * (LEVELS - 1));
    }

    static Rgba bucketColor(int key) {
        int qr = key / (LEVELS * LEVELS);
        int qg = (key / LEVELS) % LEVELS;
        int qb = key % LEVELS;
        float scale = LEVELS - 1;
        return new Rgba(qr / scale, qg / scale, qb / scale, 1f);
    }
}
