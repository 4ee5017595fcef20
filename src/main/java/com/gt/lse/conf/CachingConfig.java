package com.gt.lse.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

@Configuration
@EnableCaching
@EnableScheduling
public class CachingConfig {

    private static final Logger log = LoggerFactory.getLogger(CachingConfig.class);

    public static final String LEARNING_ITEMS = "learning_items";
    private static final long CACHE_EVICT_SCHEDULE_MS = 15 * 60 * 1000;

    @Bean
    public CacheManager getLearningItemCacheManager() {
        return new ConcurrentMapCacheManager(LEARNING_ITEMS);
    }

    // Published items are immutable, but new items and retired payloads should become visible eventually
    @CacheEvict(allEntries = true, value = {LEARNING_ITEMS})
    @Scheduled(fixedDelay = CACHE_EVICT_SCHEDULE_MS,  initialDelay = CACHE_EVICT_SCHEDULE_MS)
    public void reportLearningItemCacheEvict() {
        log.info("Flushing " + LEARNING_ITEMS + " cache.");
    }

}
