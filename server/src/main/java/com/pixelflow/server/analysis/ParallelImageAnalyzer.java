package com.pixelflow.server.analysis;

import com.pixelflow.server.error.AnalysisFailedException;
import com.pixelflow.server.generation.CancellationToken;
import com.pixelflow.server.generation.GenerationStage;
import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.image.PixelBufferScaler;
import com.pixelflow.server.image.Rgba;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Single-pass analyzer. Rows are scanned in parallel into private
 * {@link RowStatistics} and reduced on the calling thread once all rows are done.
 */
public class ParallelImageAnalyzer implements ImageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ParallelImageAnalyzer.class);

    static final float DEFAULT_CONTRAST = 0.5f;
    static final int MAX_DOMINANT_COLORS = 5;

    private final int maxDimension;

    public ParallelImageAnalyzer() {
        this(PixelBufferScaler.DEFAULT_MAX_DIMENSION);
    }

    public ParallelImageAnalyzer(int maxDimension) {
        this.maxDimension = maxDimension;
    }

    @Override
    public ImageAnalysis analyze(PixelBuffer source, CancellationToken token) {
        long start = System.currentTimeMillis();
        if (!source.validate()) {
            logger.warn("Pixel buffer {}x{} failed validation, unreadable pixels will read as black",
                    source.getWidth(), source.getHeight());
        }
        token.throwIfCancelled(GenerationStage.ANALYZING);

        // 1. Bound the cost of the scan
        PixelBuffer buffer = PixelBufferScaler.downsampleIfNeeded(source, maxDimension);
        float scale = (float) buffer.getWidth() / source.getWidth();

        // 2. Parallel row pass, one private accumulator per row
        int height = buffer.getHeight();
        RowStatistics[] rows = new RowStatistics[height];
        IntStream.range(0, height).parallel().forEach(y -> {
            if (!token.isCancelled()) {
                rows[y] = RowStatistics.scan(buffer, y);
            }
        });
        // A cancelled pass leaves holes in rows; its result is discarded
        token.throwIfCancelled(GenerationStage.ANALYZING);

        // 3. Reduce in row order
        RowStatistics total = new RowStatistics();
        for (RowStatistics row : rows) {
            total.merge(row);
        }
        if (total.coloredPixels == 0) {
            throw new AnalysisFailedException("Image contains no colored pixels");
        }

        ImageAnalysis analysis = derive(total, source, buffer, scale);
        logger.debug("Analyzed {}x{} in {} ms: {}", source.getWidth(), source.getHeight(),
                System.currentTimeMillis() - start, analysis);
        return analysis;
    }

    private ImageAnalysis derive(RowStatistics total, PixelBuffer source, PixelBuffer scanned, float scale) {
        double colored = total.coloredPixels;
        double totalPixels = scanned.totalPixels();

        Rgba average = new Rgba(
                clamp01((float) (total.sumR / colored)),
                clamp01((float) (total.sumG / colored)),
                clamp01((float) (total.sumB / colored)),
                1f);
        float brightness = clamp01((average.getR() + average.getG() + average.getB()) / 3f);
        float saturation = clamp01((float) (total.sumSaturation / colored));

        float contrast = DEFAULT_CONTRAST;
        if (total.maxBrightness > total.minBrightness) {
            contrast = clamp01((total.maxBrightness - total.minBrightness) / total.maxBrightness);
        }

        float pixelDensity = clamp01((float) (colored / totalPixels));
        float edgeDensity = clamp01((float) (total.edgePixels / totalPixels));
        int complexity = Math.max(0, Math.min(10, Math.round(edgeDensity * 20f)));

        List<Rgba> dominant = dominantColors(total);
        float variance = colorVariance(total, average);

        return new ImageAnalysis(source.getWidth(), source.getHeight(), scale, average,
                contrast, brightness, pixelDensity, edgeDensity, saturation, complexity,
                dominant, variance);
    }

    private static List<Rgba> dominantColors(RowStatistics total) {
        // Stable sort keeps first-seen order among equal counts
        Integer[] order = new Integer[total.bucketOrderSize];
        for (int i = 0; i < order.length; i++) {
            order[i] = total.bucketOrder[i];
        }
        Arrays.sort(order, Comparator.comparingInt((Integer key) -> total.bucketCounts[key]).reversed());

        List<Rgba> result = new ArrayList<>();
        for (int i = 0; i < Math.min(MAX_DOMINANT_COLORS, order.length); i++) {
            result.add(RowStatistics.bucketColor(order[i]));
        }
        return result;
    }

    private static float colorVariance(RowStatistics total, Rgba average) {
        double weighted = 0;
        for (int i = 0; i < total.bucketOrderSize; i++) {
            int key = total.bucketOrder[i];
            float d = RowStatistics.bucketColor(key).distanceTo(average);
            weighted += (double) total.bucketCounts[key] * d * d;
        }
        return (float) Math.sqrt(weighted / total.coloredPixels);
    }

    private static float clamp01(float v) {
        if (Float.isNaN(v)) {
            return 0f;
        }
        return Math.max(0f, Math.min(1f, v));
    }
}
