package com.pixelflow.server.sampling;

import com.pixelflow.server.generation.SamplingStrategyType;
import com.pixelflow.server.image.PixelBuffer;

import java.util.ArrayList;
import java.util.List;

/**
 * Very important pixels, then mid-importance pixels, then a uniform baseline,
 * in proportions set by the quality tier.
 */
public class HybridSamplingStrategy implements SamplingStrategy {

    static final float HIGH_THRESHOLD_FACTOR = 1.5f;
    static final float LOW_THRESHOLD_FACTOR = 0.5f;

    @Override
    public SamplingStrategyType getType() {
        return SamplingStrategyType.HYBRID;
    }

    @Override
    public List<Sample> sample(SamplingContext context, int targetCount) {
        PixelBuffer buffer = context.getBuffer();
        if (targetCount >= buffer.totalPixels()) {
            return UniformSamplingStrategy.fullCoverage(context);
        }
        SamplingParams params = context.getParams();
        float[] split = params.getQuality().getHybridSplit();
        int veryCount = Math.round(targetCount * split[0]);
        int middleCount = Math.round(targetCount * split[1]);

        float threshold = params.getImportanceThreshold();
        float high = Math.min(1f, threshold * HIGH_THRESHOLD_FACTOR);
        float low = threshold * LOW_THRESHOLD_FACTOR;

        // One scan at the low threshold, partitioned afterwards
        List<Candidate> candidates = ImportanceSamplingStrategy.collectCandidates(context, low, targetCount);
        List<Candidate> very = new ArrayList<>();
        List<Candidate> middle = new ArrayList<>();
        for (Candidate c : candidates) {
            if (c.score >= high) {
                very.add(c);
            } else {
                middle.add(c);
            }
        }
        very.sort(Candidate.BY_SCORE_DESC);
        middle.sort(Candidate.BY_SCORE_DESC);

        SampleSetBuilder builder = new SampleSetBuilder(buffer, targetCount);
        builder.addAll(very, veryCount);
        // Shortfall of the first tier rolls into the second
        builder.addAll(middle, veryCount + middleCount);
        builder.fillUniformGrid(context);
        builder.topUp(context);
        return builder.build();
    }
}
