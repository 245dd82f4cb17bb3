package com.pixelflow.server.sampling;

import com.pixelflow.server.generation.SamplingStrategyType;
import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.image.PixelRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Spends {@code importantSamplingRatio} of the budget on the highest-scoring
 * pixels, balanced between the top and bottom halves, and the rest on a uniform grid.
 */
public class ImportanceSamplingStrategy implements SamplingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ImportanceSamplingStrategy.class);

    static final int MIN_CANDIDATES = 10;

    @Override
    public SamplingStrategyType getType() {
        return SamplingStrategyType.IMPORTANCE;
    }

    @Override
    public List<Sample> sample(SamplingContext context, int targetCount) {
        PixelBuffer buffer = context.getBuffer();
        if (targetCount >= buffer.totalPixels()) {
            return UniformSamplingStrategy.fullCoverage(context);
        }
        SamplingParams params = context.getParams();
        int importantCount = Math.round(targetCount * params.getImportantSamplingRatio());

        List<Candidate> candidates = collectCandidates(context, params.getImportanceThreshold(), targetCount);
        logger.debug("Importance sampling: {} candidates for {} important slots", candidates.size(), importantCount);

        SampleSetBuilder builder = new SampleSetBuilder(buffer, targetCount);
        selectBalanced(builder, candidates, importantCount, buffer.getHeight(), params.getTopBottomRatio());
        builder.fillUniformGrid(context);
        builder.topUp(context);
        return builder.build();
    }

    /**
     * Candidates at or above {@code threshold}, topped up with grid fallbacks
     * when too few pass, thinned when anti-clustering is on.
     */
    static List<Candidate> collectCandidates(SamplingContext context, float threshold, int targetCount) {
        PixelBuffer buffer = context.getBuffer();
        ImportanceScorer scorer = new ImportanceScorer(context.getParams(),
                context.getAnalysis().getDominantColors());
        PixelRegion all = PixelRegion.full(buffer.getWidth(), buffer.getHeight());
        int stride = Math.max(ImportanceScorer.scanStride(buffer.getWidth()),
                ImportanceScorer.scanStride(buffer.getHeight()));

        List<Candidate> candidates = scorer.scan(context, all, stride, threshold);
        if (candidates.size() < Math.max(targetCount / 4, MIN_CANDIDATES)) {
            logger.debug("Only {} candidates above {}, adding grid fallback", candidates.size(), threshold);
            List<Candidate> merged = new ArrayList<>(candidates);
            merged.addAll(scorer.fallback(context, all, Math.max(2, stride * 2)));
            candidates = merged;
        }
        if (context.getParams().isApplyAntiClustering()) {
            candidates = AntiClusteringFilter.filter(candidates, buffer.totalPixels(), targetCount);
        }
        return candidates;
    }

    /**
     * Adds up to {@code count} candidates, {@code topRatio} of them from rows
     * above the vertical midpoint, by descending score. Slots one half cannot
     * fill go to the best remaining candidates of the other.
     */
    static void selectBalanced(SampleSetBuilder builder, List<Candidate> candidates, int count,
            int height, float topRatio) {
        List<Candidate> top = new ArrayList<>();
        List<Candidate> bottom = new ArrayList<>();
        int mid = height / 2;
        for (Candidate c : candidates) {
            if (c.y < mid) {
                top.add(c);
            } else {
                bottom.add(c);
            }
        }
        top.sort(Candidate.BY_SCORE_DESC);
        bottom.sort(Candidate.BY_SCORE_DESC);

        int start = builder.size();
        int topQuota = Math.round(count * topRatio);
        builder.addAll(top, start + topQuota);
        builder.addAll(bottom, start + count);

        if (builder.size() < start + count) {
            List<Candidate> rest = new ArrayList<>(candidates);
            rest.sort(Candidate.BY_SCORE_DESC);
            builder.addAll(rest, start + count);
        }
    }
}
