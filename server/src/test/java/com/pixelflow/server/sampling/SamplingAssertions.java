package com.pixelflow.server.sampling;

import com.pixelflow.server.image.PixelBuffer;
import org.junit.jupiter.api.Assertions;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class SamplingAssertions {

    private SamplingAssertions() {
    }

    static void assertValidSampleSet(List<Sample> samples, PixelBuffer buffer, int expected) {
        Assertions.assertEquals(expected, samples.size());
        Set<Long> seen = new HashSet<>();
        for (Sample s : samples) {
            Assertions.assertTrue(buffer.contains(s.getX(), s.getY()), "out of bounds: " + s);
            Assertions.assertTrue(seen.add((long) s.getY() * buffer.getWidth() + s.getX()), "duplicate: " + s);
            Assertions.assertEquals(buffer.colorAt(s.getX(), s.getY()), s.getColor());
        }
    }

    static int countLeftHalf(List<Sample> samples, int width) {
        int count = 0;
        for (Sample s : samples) {
            if (s.getX() < width / 2) {
                count++;
            }
        }
        return count;
    }
}
