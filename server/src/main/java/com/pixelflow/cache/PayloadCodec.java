package com.pixelflow.cache;

import java.io.IOException;

/**
 * Turns cached values into the bytes stored in a payload file and back.
 */
public interface PayloadCodec<V> {

    byte[] encode(V value) throws IOException;

    V decode(byte[] bytes) throws IOException;
}
