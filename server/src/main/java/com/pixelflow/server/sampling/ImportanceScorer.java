package com.pixelflow.server.sampling;

import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.image.PixelRegion;
import com.pixelflow.server.image.Rgba;

import java.util.ArrayList;
import java.util.List;

/**
 * Importance of a pixel: local contrast against its neighbourhood, saturation
 * and distance from the dominant colours, with a penalty for near-white
 * background pixels.
 */
public class ImportanceScorer {

    static final float ALPHA_THRESHOLD = 0.1f;
    static final float FALLBACK_ALPHA = 0.05f;
    static final float FALLBACK_SCORE = 0.1f;
    static final float SCORE_SCALE = 3f;
    static final float BACKGROUND_PENALTY = 0.15f;

    private final SamplingParams params;
    private final List<Rgba> dominantColors;

    public ImportanceScorer(SamplingParams params, List<Rgba> dominantColors) {
        this.params = params;
        this.dominantColors = dominantColors;
    }

    public float score(PixelBuffer buffer, int x, int y) {
        int argb = buffer.packedArgbAt(x, y);
        float a = alpha(argb);
        if (a <= ALPHA_THRESHOLD) {
            return 0f;
        }
        float r = red(argb);
        float g = green(argb);
        float b = blue(argb);

        // 1. Local contrast
        int radius = params.getEdgeRadius();
        float distanceSum = 0f;
        int neighbours = 0;
        for (int ny = Math.max(0, y - radius); ny <= Math.min(buffer.getHeight() - 1, y + radius); ny++) {
            for (int nx = Math.max(0, x - radius); nx <= Math.min(buffer.getWidth() - 1, x + radius); nx++) {
                if (nx == x && ny == y) {
                    continue;
                }
                int n = buffer.packedArgbAt(nx, ny);
                float dr = r - red(n);
                float dg = g - green(n);
                float db = b - blue(n);
                distanceSum += (float) Math.sqrt(dr * dr + dg * dg + db * db);
                neighbours++;
            }
        }
        float contrast = neighbours > 0 ? distanceSum / neighbours : 0f;

        // 2. Saturation as deviation from grey
        float mean = (r + g + b) / 3f;
        float saturation = (float) Math.sqrt(((r - mean) * (r - mean) + (g - mean) * (g - mean)
                + (b - mean) * (b - mean)) / 3f);

        // 3. Uniqueness against the dominant palette
        float uniqueness = 0f;
        if (!dominantColors.isEmpty()) {
            Rgba color = new Rgba(r, g, b, 1f);
            float min = Float.MAX_VALUE;
            for (Rgba dominant : dominantColors) {
                min = Math.min(min, color.distanceTo(dominant));
            }
            uniqueness = Math.min(1f, min);
        }

        float penalty = (mean > 0.8f && saturation < 0.2f) ? BACKGROUND_PENALTY : 0f;

        float combined = params.getContrastWeight() * contrast
                + params.getSaturationWeight() * saturation
                + params.getEdgeBias() * uniqueness
                - 2f * penalty;
        return Math.max(0f, Math.min(1f, combined * SCORE_SCALE));
    }

    /**
     * Scores the positions of {@code region} on a stride grid, keeping those at
     * or above {@code threshold}. Near-white and transparent pixels are skipped.
     */
    List<Candidate> scan(SamplingContext context, PixelRegion region, int stride, float threshold) {
        PixelBuffer buffer = context.getBuffer();
        List<Candidate> result = new ArrayList<>();
        for (int y = region.getY(); y < region.getY() + region.getHeight(); y += stride) {
            context.checkCancelled();
            for (int x = region.getX(); x < region.getX() + region.getWidth(); x += stride) {
                int argb = buffer.packedArgbAt(x, y);
                if (alpha(argb) <= ALPHA_THRESHOLD || isNearWhite(argb)) {
                    continue;
                }
                float s = score(buffer, x, y);
                if (s >= threshold) {
                    result.add(new Candidate(x, y, s));
                }
            }
        }
        return result;
    }

    /**
     * Low-importance grid candidates used when too few pixels pass the threshold.
     */
    List<Candidate> fallback(SamplingContext context, PixelRegion region, int stride) {
        PixelBuffer buffer = context.getBuffer();
        List<Candidate> result = new ArrayList<>();
        for (int y = region.getY(); y < region.getY() + region.getHeight(); y += stride) {
            context.checkCancelled();
            for (int x = region.getX(); x < region.getX() + region.getWidth(); x += stride) {
                if (alpha(buffer.packedArgbAt(x, y)) > FALLBACK_ALPHA) {
                    result.add(new Candidate(x, y, FALLBACK_SCORE));
                }
            }
        }
        return result;
    }

    /** Stride that keeps a scan of {@code extent} pixels to roughly 512 positions. */
    public static int scanStride(int extent) {
        return Math.max(1, Math.min(extent / 512, extent / 16));
    }

    static boolean isNearWhite(int argb) {
        float r = red(argb);
        float g = green(argb);
        float b = blue(argb);
        float brightness = (r + g + b) / 3f;
        float chroma = Math.max(r, Math.max(g, b)) - Math.min(r, Math.min(g, b));
        return brightness > 0.95f && chroma < 0.05f;
    }

    private static float alpha(int argb) {
        return ((argb >>> 24) & 0xFF) / 255f;
    }

    private static float red(int argb) {
        return ((argb >> 16) & 0xFF) / 255f;
    }

    private static float green(int argb) {
        return ((argb >> 8) & 0xFF) / 255f;
    }

    private static float blue(int argb) {
        return (argb & 0xFF) / 255f;
    }
}
