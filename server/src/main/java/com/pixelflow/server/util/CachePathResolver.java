package com.pixelflow.server.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

public class CachePathResolver {

    private static final Logger logger = LoggerFactory.getLogger(CachePathResolver.class);

    public static final String CACHE_DIR_PROPERTY = "pixelflow.cache.dir";
    public static final String DEFAULT_CACHE_DIR = "pixelflow-cache";

    public static Path resolveCacheDirectory() {
        return resolveCacheDirectory(ConfigLoader.loadRoot());
    }

    public static Path resolveCacheDirectory(ConfigLoader.ConfigRoot root) {
        // 1. Check System Property
        String sysProp = System.getProperty(CACHE_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return Paths.get(sysProp);
        }

        // 2. Check Config File
        if (root != null && root.cache_directory != null && !root.cache_directory.isEmpty()) {
            return Paths.get(root.cache_directory);
        }

        // 3. Default
        logger.debug("No cache directory configured, using ./{}", DEFAULT_CACHE_DIR);
        return Paths.get(".", DEFAULT_CACHE_DIR);
    }
}
