package com.pixelflow.server.sampling;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the best-scoring candidate of each square quantization cell. Cells are
 * sized so that at least twice the requested count of cells fits in the area,
 * thinning clumps without starving the selection.
 */
public class AntiClusteringFilter {

    static final int MAX_CELL_SIZE = 6;

    private AntiClusteringFilter() {
    }

    static int cellSize(long area, int targetCount) {
        if (targetCount <= 0) {
            return 1;
        }
        int size = (int) Math.floor(Math.sqrt((double) area / (2.0 * targetCount)));
        return Math.max(1, Math.min(MAX_CELL_SIZE, size));
    }

    /**
     * Returns the surviving candidates in their original order. Among equal
     * scores the earlier candidate wins.
     */
    static List<Candidate> filter(List<Candidate> candidates, long area, int targetCount) {
        int cell = cellSize(area, targetCount);
        if (cell <= 1) {
            return candidates;
        }
        Map<Long, Candidate> best = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            long key = ((long) (c.y / cell) << 32) | (c.x / cell);
            Candidate current = best.get(key);
            if (current == null || c.score > current.score) {
                best.put(key, c);
            }
        }
        List<Candidate> kept = new ArrayList<>(best.size());
        for (Candidate c : candidates) {
            long key = ((long) (c.y / cell) << 32) | (c.x / cell);
            if (best.get(key) == c) {
                kept.add(c);
            }
        }
        return kept;
    }
}
