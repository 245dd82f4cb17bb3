package com.pixelflow.server.generation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CacheKeyFactoryTest {

    @Test
    public void testKeyFormat() {
        String key = CacheKeyFactory.create(640, 480, ParticleGenerationConfig.standard());
        assertEquals("generation_v1_640x480_1000_standard_importance_0.30", key);
    }

    @Test
    public void testOutputAffectingFieldsChangeKey() {
        ParticleGenerationConfig base = ParticleGenerationConfig.standard();
        String key = CacheKeyFactory.create(640, 480, base);

        assertNotEquals(key, CacheKeyFactory.create(641, 480, base));
        assertNotEquals(key, CacheKeyFactory.create(640, 480, base.withTargetParticleCount(999)));
        assertNotEquals(key, CacheKeyFactory.create(640, 480, base.withQualityPreset(QualityPreset.HIGH)));
        assertNotEquals(key, CacheKeyFactory.create(640, 480,
                base.withSamplingStrategy(SamplingStrategyType.ADAPTIVE)));
        assertNotEquals(key, CacheKeyFactory.create(640, 480, base.withImportanceThreshold(0.5f)));
    }

    @Test
    public void testUnrelatedFieldsKeepKey() {
        ParticleGenerationConfig base = ParticleGenerationConfig.standard();
        String key = CacheKeyFactory.create(640, 480, base);

        assertEquals(key, CacheKeyFactory.create(640, 480, base.withCachingEnabled(false)));
        assertEquals(key, CacheKeyFactory.create(640, 480, base.withMaxConcurrentOperations(1)));
        assertEquals(key, CacheKeyFactory.create(640, 480, base.withCacheSizeLimitBytes(1024)));
    }
}
