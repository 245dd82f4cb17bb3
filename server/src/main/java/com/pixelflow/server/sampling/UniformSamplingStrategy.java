package com.pixelflow.server.sampling;

import com.pixelflow.server.generation.SamplingStrategyType;
import com.pixelflow.server.image.PixelBuffer;

import java.util.ArrayList;
import java.util.List;

/**
 * Edge-inclusive grid whose aspect ratio follows the image.
 */
public class UniformSamplingStrategy implements SamplingStrategy {

    @Override
    public SamplingStrategyType getType() {
        return SamplingStrategyType.UNIFORM;
    }

    @Override
    public List<Sample> sample(SamplingContext context, int targetCount) {
        PixelBuffer buffer = context.getBuffer();
        if (targetCount >= buffer.totalPixels()) {
            return fullCoverage(context);
        }
        SampleSetBuilder builder = new SampleSetBuilder(buffer, targetCount);
        builder.fillUniformGrid(context);
        // Rounding can map two grid cells onto one pixel on narrow images
        builder.topUp(context);
        return builder.build();
    }

    static List<Sample> fullCoverage(SamplingContext context) {
        PixelBuffer buffer = context.getBuffer();
        List<Sample> all = new ArrayList<>((int) buffer.totalPixels());
        for (int y = 0; y < buffer.getHeight(); y++) {
            context.checkCancelled();
            for (int x = 0; x < buffer.getWidth(); x++) {
                all.add(new Sample(x, y, buffer.colorAt(x, y)));
            }
        }
        return all;
    }

    /**
     * Grid positions for {@code count} samples in row-major order. The grid height
     * is trimmed to the rows actually used, so the last row lands on the bottom edge.
     */
    static List<int[]> gridPositions(int width, int height, int count) {
        List<int[]> positions = new ArrayList<>(count);
        if (count <= 0) {
            return positions;
        }
        double aspectRatio = (double) width / height;
        int gridHeight = Math.max(1, (int) Math.round(Math.sqrt(count / aspectRatio)));
        int gridWidth = (int) Math.ceil((double) count / gridHeight);
        gridHeight = (int) Math.ceil((double) count / gridWidth);

        for (int i = 0; i < count; i++) {
            int gx = i % gridWidth;
            int gy = i / gridWidth;
            positions.add(new int[] {
                    gridCoord(gx, gridWidth, width - 1),
                    gridCoord(gy, gridHeight, height - 1)
            });
        }
        return positions;
    }

    static int gridCoord(int index, int gridSize, int maxCoord) {
        if (gridSize > 1) {
            return (int) Math.round((double) index / (gridSize - 1) * maxCoord);
        }
        return maxCoord / 2;
    }
}
