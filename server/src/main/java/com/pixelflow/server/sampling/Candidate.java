package com.pixelflow.server.sampling;

import java.util.Comparator;

/**
 * Scored pixel position. Lists of candidates are built in row-major scan
 * order, so a stable sort by score keeps scan order among ties.
 */
final class Candidate {

    static final Comparator<Candidate> BY_SCORE_DESC = (a, b) -> Float.compare(b.score, a.score);

    final int x;
    final int y;
    final float score;

    Candidate(int x, int y, float score) {
        this.x = x;
        this.y = y;
        this.score = score;
    }
}
