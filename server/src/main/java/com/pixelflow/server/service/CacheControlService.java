package com.pixelflow.server.service;

import com.pixelflow.cache.ResultCache;
import com.pixelflow.server.generation.Particle;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CacheControlService {

    private final GenerationService generationService;

    public CacheControlService(GenerationService generationService) {
        this.generationService = generationService;
    }

    public static class CacheStats {
        public boolean available;
        public int entries;
        public long sizeBytes;
        public long sizeLimitBytes;
    }

    /**
     * Removes every cached generation result.
     * Use this when sampling or assembly behaviour changes.
     */
    public int clearAll() {
        ResultCache<List<Particle>> cache = generationService.getCache();
        if (cache == null) {
            return 0;
        }
        int removed = cache.getCount();
        generationService.clearCache();
        return removed;
    }

    public CacheStats stats() {
        CacheStats stats = new CacheStats();
        ResultCache<List<Particle>> cache = generationService.getCache();
        if (cache != null) {
            stats.available = true;
            stats.entries = cache.getCount();
            stats.sizeBytes = cache.getSizeBytes();
            stats.sizeLimitBytes = cache.getSizeLimitBytes();
        }
        return stats;
    }
}
