package com.company.powersense.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

/**
 * Drops query caches after a write. A no-op when caching is disabled.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CacheEvictionService {

    public static final String MEASUREMENT_COUNT_CACHE = "measurementCount";
    public static final String LATEST_MEASUREMENTS_CACHE = "latestMeasurements";

    private final ObjectProvider<CacheManager> cacheManager;

    public void onMeasurementsWritten(int rowsWritten) {
        if (rowsWritten <= 0) {
            return;
        }
        CacheManager manager = cacheManager.getIfAvailable();
        if (manager == null) {
            return;
        }

        for (String name : new String[]{MEASUREMENT_COUNT_CACHE, LATEST_MEASUREMENTS_CACHE}) {
            Cache cache = manager.getCache(name);
            if (cache != null) {
                cache.clear();
                log.debug("Cleared {} cache after {} new rows", name, rowsWritten);
            }
        }
    }
}
