package uk.gegc.coursemaker.shared.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Key-value cache that confines every entry to one tenant.
 *
 * <p>Every logical key is stored under {@code tenant:{tenantId}:{key}}, so a lookup for one
 * tenant can never resolve another tenant's entry. Entries carry their own expiry on top of the
 * base cache's write expiry.
 *
 * <p>The base cache is never a hard dependency: when it is missing or throws, reads miss and
 * writes are dropped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantCache {

    private final CacheManager cacheManager;
    private final TenantCacheProperties properties;
    private final Clock clock;

    public <T> Optional<T> get(UUID tenantId, String key, Class<T> type) {
        String physicalKey = physicalKey(tenantId, key);
        Cache cache = baseCache();
        if (cache == null) {
            return Optional.empty();
        }
        try {
            CachedValue cached = cache.get(physicalKey, CachedValue.class);
            if (cached == null) {
                return Optional.empty();
            }
            if (cached.isExpired(clock.instant())) {
                cache.evict(physicalKey);
                return Optional.empty();
            }
            if (!type.isInstance(cached.value())) {
                log.warn("Tenant cache entry {} holds {} but {} was requested; treating as miss",
                        physicalKey, cached.value().getClass().getSimpleName(), type.getSimpleName());
                return Optional.empty();
            }
            return Optional.of(type.cast(cached.value()));
        } catch (RuntimeException e) {
            log.warn("Tenant cache read failed for key {}; treating as miss: {}", physicalKey, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(UUID tenantId, String key, Object value) {
        put(tenantId, key, value, properties.getDefaultTtl());
    }

    public void put(UUID tenantId, String key, Object value, Duration ttl) {
        String physicalKey = physicalKey(tenantId, key);
        if (value == null) {
            evict(tenantId, key);
            return;
        }
        Cache cache = baseCache();
        if (cache == null) {
            return;
        }
        try {
            cache.put(physicalKey, new CachedValue(value, clock.instant().plus(ttl)));
        } catch (RuntimeException e) {
            log.warn("Tenant cache write failed for key {}; skipping: {}", physicalKey, e.getMessage());
        }
    }

    public void evict(UUID tenantId, String key) {
        String physicalKey = physicalKey(tenantId, key);
        Cache cache = baseCache();
        if (cache == null) {
            return;
        }
        try {
            cache.evict(physicalKey);
        } catch (RuntimeException e) {
            log.warn("Tenant cache evict failed for key {}: {}", physicalKey, e.getMessage());
        }
    }

    /**
     * Evicts every entry of the tenant whose logical key starts with {@code keyPrefix}.
     * Needs a map-backed native cache (Caffeine); other stores fall back to a no-op.
     */
    public void evictByPrefix(UUID tenantId, String keyPrefix) {
        String physicalPrefix = physicalKey(tenantId, keyPrefix);
        Cache cache = baseCache();
        if (cache == null) {
            return;
        }
        try {
            Object nativeCache = cache.getNativeCache();
            if (nativeCache instanceof com.github.benmanes.caffeine.cache.Cache<?, ?> caffeine) {
                Map<?, ?> entries = caffeine.asMap();
                entries.keySet().removeIf(k -> k instanceof String s && s.startsWith(physicalPrefix));
            } else {
                log.warn("Prefix eviction not supported by {}; entries under {} expire by TTL",
                        nativeCache.getClass().getSimpleName(), physicalPrefix);
            }
        } catch (RuntimeException e) {
            log.warn("Tenant cache prefix eviction failed for {}: {}", physicalPrefix, e.getMessage());
        }
    }

    public static String physicalKey(UUID tenantId, String key) {
        if (tenantId == null) {
            throw new IllegalArgumentException("Tenant ID is required for tenant cache access");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key cannot be blank");
        }
        return "tenant:" + tenantId + ":" + key;
    }

    private Cache baseCache() {
        try {
            Cache cache = cacheManager.getCache(properties.getCacheName());
            if (cache == null) {
                log.warn("Base cache '{}' is not available; tenant cache degraded to no-op", properties.getCacheName());
            }
            return cache;
        } catch (RuntimeException e) {
            log.warn("Base cache lookup failed; tenant cache degraded to no-op: {}", e.getMessage());
            return null;
        }
    }

    record CachedValue(Object value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
