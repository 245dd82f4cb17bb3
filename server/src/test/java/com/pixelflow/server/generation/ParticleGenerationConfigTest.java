package com.pixelflow.server.generation;

import com.pixelflow.server.sampling.SamplingParams;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParticleGenerationConfigTest {

    @Test
    public void testPresets() {
        ParticleGenerationConfig draft = ParticleGenerationConfig.draft();
        assertEquals(SamplingStrategyType.UNIFORM, draft.getSamplingStrategy());
        assertEquals(500, draft.getTargetParticleCount());
        assertFalse(draft.isCachingEnabled());
        assertEquals(2, draft.getMaxConcurrentOperations());

        ParticleGenerationConfig standard = ParticleGenerationConfig.standard();
        assertEquals(SamplingStrategyType.IMPORTANCE, standard.getSamplingStrategy());
        assertEquals(1000, standard.getTargetParticleCount());
        assertTrue(standard.isCachingEnabled());
        assertEquals(100L * 1024 * 1024, standard.getCacheSizeLimitBytes());

        assertEquals(SamplingStrategyType.HYBRID, ParticleGenerationConfig.high().getSamplingStrategy());
        assertEquals(5000, ParticleGenerationConfig.ultra().getTargetParticleCount());
        assertEquals(QualityPreset.ULTRA, ParticleGenerationConfig.forPreset(QualityPreset.ULTRA).getQualityPreset());
    }

    @Test
    public void testWithLeavesOriginalUntouched() {
        ParticleGenerationConfig base = ParticleGenerationConfig.standard();
        ParticleGenerationConfig changed = base.withTargetParticleCount(42).withDisplayMode(ImageDisplayMode.FILL);

        assertEquals(1000, base.getTargetParticleCount());
        assertEquals(ImageDisplayMode.FIT, base.getDisplayMode());
        assertEquals(42, changed.getTargetParticleCount());
        assertEquals(ImageDisplayMode.FILL, changed.getDisplayMode());
        assertEquals(base.getImportanceThreshold(), changed.getImportanceThreshold(), 0f);
    }

    @Test
    public void testSamplingParamsApplyQualityMultipliers() {
        SamplingParams standard = ParticleGenerationConfig.standard().samplingParams();
        assertEquals(0.3f, standard.getImportanceThreshold(), 1e-6f);
        assertEquals(0.4f, standard.getContrastWeight(), 1e-6f);
        assertEquals(2, standard.getEdgeRadius());

        SamplingParams ultra = ParticleGenerationConfig.ultra().samplingParams();
        assertEquals(0.75f, ultra.getImportanceThreshold(), 1e-6f);
        assertEquals(0.75f, ultra.getContrastWeight(), 1e-6f);
        assertEquals(0.56f, ultra.getSaturationWeight(), 1e-6f);
        assertEquals(5, ultra.getEdgeRadius());
        assertEquals(QualityPreset.ULTRA, ultra.getQuality());

        // Draft lowers the radius but never below one
        assertEquals(1, ParticleGenerationConfig.draft().samplingParams().getEdgeRadius());
    }

    @Test
    public void testAntiClusteringFlowsIntoParams() {
        assertTrue(ParticleGenerationConfig.standard().samplingParams().isApplyAntiClustering());
        assertFalse(ParticleGenerationConfig.standard().withAntiClustering(false).samplingParams()
                .isApplyAntiClustering());
    }

    @Test
    public void testPresetLookupByName() {
        assertEquals(QualityPreset.HIGH, QualityPreset.fromName("high"));
        assertThrows(IllegalArgumentException.class, () -> QualityPreset.fromName("extreme"));
        assertEquals(SamplingStrategyType.ADAPTIVE, SamplingStrategyType.fromName("Adaptive"));
    }
}
