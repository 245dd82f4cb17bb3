package com.pixelflow.server.sampling;

import java.util.List;

/**
 * Coverage figures for a sample set, used for debug logging and tests.
 */
public final class SampleSetDiagnostics {

    static final int COVERAGE_GRID = 4;

    private final float coverageRatio;
    private final boolean cornersCovered;

    private SampleSetDiagnostics(float coverageRatio, boolean cornersCovered) {
        this.coverageRatio = coverageRatio;
        this.cornersCovered = cornersCovered;
    }

    public static SampleSetDiagnostics of(List<Sample> samples, int width, int height) {
        boolean[] cells = new boolean[COVERAGE_GRID * COVERAGE_GRID];
        // top-left, top-right, bottom-left, bottom-right quadrant of a 10% margin
        boolean[] corners = new boolean[4];
        int marginX = Math.max(1, width / 10);
        int marginY = Math.max(1, height / 10);
        for (Sample s : samples) {
            int cx = Math.min(COVERAGE_GRID - 1, s.getX() * COVERAGE_GRID / width);
            int cy = Math.min(COVERAGE_GRID - 1, s.getY() * COVERAGE_GRID / height);
            cells[cy * COVERAGE_GRID + cx] = true;

            boolean left = s.getX() < marginX;
            boolean right = s.getX() >= width - marginX;
            boolean top = s.getY() < marginY;
            boolean bottom = s.getY() >= height - marginY;
            if (top && left) {
                corners[0] = true;
            }
            if (top && right) {
                corners[1] = true;
            }
            if (bottom && left) {
                corners[2] = true;
            }
            if (bottom && right) {
                corners[3] = true;
            }
        }
        int covered = 0;
        for (boolean c : cells) {
            if (c) {
                covered++;
            }
        }
        boolean allCorners = corners[0] && corners[1] && corners[2] && corners[3];
        return new SampleSetDiagnostics((float) covered / cells.length, allCorners);
    }

    public float getCoverageRatio() {
        return coverageRatio;
    }

    public boolean isCornersCovered() {
        return cornersCovered;
    }

    @Override
    public String toString() {
        return String.format("coverage=%.2f corners=%s", coverageRatio, cornersCovered);
    }
}
