package com.pixelflow.server.sampling;

import com.pixelflow.server.image.PixelBuffer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Accumulates distinct samples up to a fixed capacity.
 */
final class SampleSetBuilder {

    static final int COARSE_GRID_DIVISIONS = 100;
    static final int RANDOM_ATTEMPTS_PER_SLOT = 4;

    private final PixelBuffer buffer;
    private final int capacity;
    private final List<Sample> samples;
    private final Set<Long> used = new HashSet<>();

    SampleSetBuilder(PixelBuffer buffer, int capacity) {
        this.buffer = buffer;
        this.capacity = (int) Math.min(capacity, buffer.totalPixels());
        this.samples = new ArrayList<>(this.capacity);
    }

    boolean add(int x, int y) {
        if (isFull() || !buffer.contains(x, y)) {
            return false;
        }
        if (!used.add(positionKey(x, y))) {
            return false;
        }
        samples.add(new Sample(x, y, buffer.colorAt(x, y)));
        return true;
    }

    /** Adds candidates in list order until {@code limit} samples are held. */
    int addAll(List<Candidate> candidates, int limit) {
        int added = 0;
        for (Candidate c : candidates) {
            if (size() >= limit || isFull()) {
                break;
            }
            if (add(c.x, c.y)) {
                added++;
            }
        }
        return added;
    }

    boolean isUsed(int x, int y) {
        return used.contains(positionKey(x, y));
    }

    boolean isFull() {
        return samples.size() >= capacity;
    }

    int size() {
        return samples.size();
    }

    int remaining() {
        return capacity - samples.size();
    }

    /** Spreads the remaining slots over an edge-inclusive uniform grid. */
    void fillUniformGrid(SamplingContext context) {
        int count = remaining();
        if (count <= 0) {
            return;
        }
        for (int[] p : UniformSamplingStrategy.gridPositions(buffer.getWidth(), buffer.getHeight(), count)) {
            add(p[0], p[1]);
        }
        context.checkCancelled();
    }

    /**
     * Fills whatever is left: a coarse grid, then seeded random positions, then
     * a row-major sweep, which always reaches capacity.
     */
    void topUp(SamplingContext context) {
        if (isFull()) {
            return;
        }
        int stepX = Math.max(1, buffer.getWidth() / COARSE_GRID_DIVISIONS);
        int stepY = Math.max(1, buffer.getHeight() / COARSE_GRID_DIVISIONS);
        for (int y = 0; y < buffer.getHeight() && !isFull(); y += stepY) {
            for (int x = 0; x < buffer.getWidth() && !isFull(); x += stepX) {
                add(x, y);
            }
        }
        context.checkCancelled();

        Random random = context.newRandom();
        int attempts = remaining() * RANDOM_ATTEMPTS_PER_SLOT;
        for (int i = 0; i < attempts && !isFull(); i++) {
            add(random.nextInt(buffer.getWidth()), random.nextInt(buffer.getHeight()));
        }

        for (int y = 0; y < buffer.getHeight() && !isFull(); y++) {
            for (int x = 0; x < buffer.getWidth() && !isFull(); x++) {
                add(x, y);
            }
        }
    }

    List<Sample> build() {
        return samples;
    }

    private long positionKey(int x, int y) {
        return (long) y * buffer.getWidth() + x;
    }
}
