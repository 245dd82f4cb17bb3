package com.pixelflow.util;

import com.pixelflow.cache.PayloadCodec;
import com.pixelflow.server.generation.Particle;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary payload for cached particle arrays: {@link Particle#FLOAT_FIELDS}
 * big-endian floats per particle, the motion flag stored as 0 or 1.
 */
public class ParticleArrayCodec implements PayloadCodec<List<Particle>> {

    @Override
    public byte[] encode(List<Particle> particles) {
        ByteBuffer bytes = ByteBuffer.allocate(particles.size() * Particle.FLOAT_FIELDS * Float.BYTES);
        FloatBuffer out = bytes.asFloatBuffer();
        for (Particle p : particles) {
            out.put(p.getPosition());
            out.put(p.getVelocity());
            out.put(p.getTargetPosition());
            out.put(p.getColor());
            out.put(p.getOriginalColor());
            out.put(p.getSize());
            out.put(p.getBaseSize());
            out.put(p.getLife());
            out.put(p.isIdleChaoticMotion() ? 1f : 0f);
        }
        return bytes.array();
    }

    @Override
    public List<Particle> decode(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length % (Particle.FLOAT_FIELDS * Float.BYTES) != 0) {
            throw new IOException("Corrupted particle payload of " + (bytes == null ? 0 : bytes.length) + " bytes");
        }
        FloatBuffer in = ByteBuffer.wrap(bytes).asFloatBuffer();
        int count = in.remaining() / Particle.FLOAT_FIELDS;
        List<Particle> particles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            particles.add(new Particle(
                    next(in, 3),
                    next(in, 3),
                    next(in, 3),
                    next(in, 4),
                    next(in, 4),
                    in.get(),
                    in.get(),
                    in.get(),
                    in.get() != 0f));
        }
        return particles;
    }

    private static float[] next(FloatBuffer in, int length) {
        float[] values = new float[length];
        in.get(values);
        return values;
    }
}
