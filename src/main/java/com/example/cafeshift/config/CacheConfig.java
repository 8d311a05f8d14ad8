package com.example.cafeshift.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Validated deduction schedules, keyed by deduction type and evicted when that type's table is
 * replaced.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String DEDUCTION_BRACKETS = "deduction-brackets";

    @Bean
    public CacheManager cacheManager() {
        // Fixed cache set: an unknown cache name is a wiring error, not a new cache.
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(DEDUCTION_BRACKETS);
        cacheManager.setAllowNullValues(false);
        return cacheManager;
    }
}
