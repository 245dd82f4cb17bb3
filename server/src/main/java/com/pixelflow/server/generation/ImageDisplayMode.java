package com.pixelflow.server.generation;

public enum ImageDisplayMode {
    /** Whole image visible, letterboxed. */
    FIT,
    /** Screen fully covered, image cropped. */
    FILL
}
