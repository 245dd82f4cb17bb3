package com.pixelflow.util;

import com.pixelflow.server.generation.Particle;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.FloatBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ParticleArrayCodecTest {

    private final ParticleArrayCodec codec = new ParticleArrayCodec();

    private static Particle particle(float seed, boolean chaotic) {
        return new Particle(
                new float[] { seed, -seed, 0f },
                new float[] { 0.01f, -0.02f, 0f },
                new float[] { seed / 2, seed / 3, 0f },
                new float[] { 1f, 0.5f, 0.25f, 1f },
                new float[] { 0.9f, 0.4f, 0.2f, 0.8f },
                3.5f + seed, 4f, 0.75f, chaotic);
    }

    @Test
    public void testPreservesEveryField() throws IOException {
        List<Particle> particles = Arrays.asList(particle(0.1f, true), particle(-0.7f, false));
        byte[] bytes = codec.encode(particles);
        Assertions.assertEquals(2 * Particle.FLOAT_FIELDS * Float.BYTES, bytes.length);

        List<Particle> decoded = codec.decode(bytes);
        Assertions.assertEquals(particles, decoded);
        Assertions.assertTrue(decoded.get(0).isIdleChaoticMotion());
        Assertions.assertFalse(decoded.get(1).isIdleChaoticMotion());
    }

    @Test
    public void testEmptyList() throws IOException {
        Assertions.assertTrue(codec.decode(codec.encode(Collections.emptyList())).isEmpty());
    }

    @Test
    public void testTruncatedPayloadIsRejected() {
        byte[] bytes = codec.encode(Collections.singletonList(particle(0.3f, false)));
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 4);
        Assertions.assertThrows(IOException.class, () -> codec.decode(truncated));
        Assertions.assertThrows(IOException.class, () -> codec.decode(null));
    }

    @Test
    public void testBigEndianLayout() {
        byte[] bytes = codec.encode(Collections.singletonList(particle(0.25f, true)));
        FloatBuffer floats = ByteBuffer.wrap(bytes).asFloatBuffer();
        Assertions.assertEquals(0.25f, floats.get(0), 0f);
        Assertions.assertEquals(-0.25f, floats.get(1), 0f);
        Assertions.assertEquals(3.75f, floats.get(17), 0f);
        Assertions.assertEquals(1f, floats.get(20), 0f);
    }
}
