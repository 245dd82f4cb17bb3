package com.pixelflow.server.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Bilinear downsampling used to put a ceiling on analysis cost.
 */
public class PixelBufferScaler {

    private static final Logger logger = LoggerFactory.getLogger(PixelBufferScaler.class);

    public static final int DEFAULT_MAX_DIMENSION = 2048;

    private PixelBufferScaler() {
    }

    public static boolean needsDownsampling(PixelBuffer buffer, int maxDimension) {
        return buffer.getWidth() > maxDimension || buffer.getHeight() > maxDimension;
    }

    /**
     * Returns {@code buffer} itself when both sides fit, otherwise a scaled copy
     * whose longer side equals {@code maxDimension}.
     */
    public static PixelBuffer downsampleIfNeeded(PixelBuffer buffer, int maxDimension) {
        if (!needsDownsampling(buffer, maxDimension)) {
            return buffer;
        }
        double scale = (double) maxDimension / Math.max(buffer.getWidth(), buffer.getHeight());
        int targetWidth = Math.max(1, (int) Math.round(buffer.getWidth() * scale));
        int targetHeight = Math.max(1, (int) Math.round(buffer.getHeight() * scale));

        BufferedImage source = buffer.toBufferedImage();
        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        logger.debug("Downsampled {}x{} to {}x{} for analysis",
                buffer.getWidth(), buffer.getHeight(), targetWidth, targetHeight);
        return PixelBuffer.fromBufferedImage(scaled);
    }
}
