package com.pixelflow.server.generation;

public interface HasParticleSpeed {

    float getParticleSpeed();
}
