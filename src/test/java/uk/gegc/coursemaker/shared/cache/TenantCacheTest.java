package uk.gegc.coursemaker.shared.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.cache.CacheManager;
import uk.gegc.coursemaker.testsupport.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("TenantCache")
class TenantCacheTest {

    private final UUID tenantA = UUID.randomUUID();
    private final UUID tenantB = UUID.randomUUID();

    private MutableClock clock;
    private TenantCache cache;

    @BeforeEach
    void setUp() {
        TenantCacheProperties properties = new TenantCacheProperties();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        cache = new TenantCache(new CacheConfig().cacheManager(properties), properties, clock);
    }

    @Test
    @DisplayName("the same logical key is isolated per tenant")
    void sameKey_isolatedPerTenant() {
        cache.put(tenantA, "ranked:course-1", "alpha");

        assertThat(cache.get(tenantA, "ranked:course-1", String.class)).contains("alpha");
        assertThat(cache.get(tenantB, "ranked:course-1", String.class)).isEmpty();

        cache.put(tenantB, "ranked:course-1", "beta");

        assertThat(cache.get(tenantA, "ranked:course-1", String.class)).contains("alpha");
        assertThat(cache.get(tenantB, "ranked:course-1", String.class)).contains("beta");
    }

    @Test
    @DisplayName("evicting a key for one tenant leaves the other tenant untouched")
    void evict_scopedToTenant() {
        cache.put(tenantA, "k", 1);
        cache.put(tenantB, "k", 2);

        cache.evict(tenantA, "k");

        assertThat(cache.get(tenantA, "k", Integer.class)).isEmpty();
        assertThat(cache.get(tenantB, "k", Integer.class)).contains(2);
    }

    @Test
    @DisplayName("prefix eviction removes matching keys of one tenant only")
    void evictByPrefix_scopedToTenant() {
        cache.put(tenantA, "knowledge:task-1:a", "x");
        cache.put(tenantA, "knowledge:task-1:b", "y");
        cache.put(tenantA, "other", "z");
        cache.put(tenantB, "knowledge:task-1:a", "w");

        cache.evictByPrefix(tenantA, "knowledge:task-1:");

        assertThat(cache.get(tenantA, "knowledge:task-1:a", String.class)).isEmpty();
        assertThat(cache.get(tenantA, "knowledge:task-1:b", String.class)).isEmpty();
        assertThat(cache.get(tenantA, "other", String.class)).contains("z");
        assertThat(cache.get(tenantB, "knowledge:task-1:a", String.class)).contains("w");
    }

    @Test
    @DisplayName("entries expire after their own TTL")
    void entries_expireAfterTtl() {
        cache.put(tenantA, "short", "v", Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(29));
        assertThat(cache.get(tenantA, "short", String.class)).contains("v");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get(tenantA, "short", String.class)).isEmpty();
    }

    @Test
    @DisplayName("a value of another type reads as a miss")
    void wrongType_isMiss() {
        cache.put(tenantA, "count", 5L);

        assertThat(cache.get(tenantA, "count", String.class)).isEmpty();
    }

    @Test
    @DisplayName("putting null evicts the entry")
    void putNull_evicts() {
        cache.put(tenantA, "k", "v");
        cache.put(tenantA, "k", null);

        assertThat(cache.get(tenantA, "k", String.class)).isEmpty();
    }

    @Test
    @DisplayName("a missing tenant id is rejected")
    void missingTenant_rejected() {
        assertThatThrownBy(() -> cache.get(null, "k", String.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TenantCache.physicalKey(tenantA, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("physical keys are namespaced by tenant")
    void physicalKey_format() {
        assertThat(TenantCache.physicalKey(tenantA, "unread"))
                .isEqualTo("tenant:" + tenantA + ":unread");
    }

    @Test
    @DisplayName("an unavailable base cache degrades to misses")
    void unavailableBaseCache_degrades() {
        CacheManager broken = mock(CacheManager.class);
        when(broken.getCache("tenant-cache")).thenThrow(new IllegalStateException("down"));
        TenantCache degraded = new TenantCache(broken, new TenantCacheProperties(), clock);

        degraded.put(tenantA, "k", "v");

        assertThat(degraded.get(tenantA, "k", String.class)).isEmpty();
    }
}
