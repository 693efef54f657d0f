package uk.gegc.coursemaker.shared.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process Caffeine store used as the base cache under {@link TenantCache}.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(TenantCacheProperties properties) {
        CaffeineCacheManager manager = new CaffeineCacheManager(properties.getCacheName());
        manager.setCaffeine(Caffeine.newBuilder()
                .recordStats()
                .maximumSize(properties.getMaximumSize())
                .expireAfterWrite(properties.getMaxTtl()));
        manager.setAllowNullValues(false);
        return manager;
    }
}
