package com.pixelflow.server.generation;

public interface HasDisplayMode {

    ImageDisplayMode getDisplayMode();
}
