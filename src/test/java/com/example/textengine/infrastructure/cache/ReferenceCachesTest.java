package com.example.textengine.infrastructure.cache;

import com.example.textengine.domain.model.FontMetrics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceCachesTest {

    @Test
    void unsizedObjectCacheIsSizedFromPageCount() {
        ReferenceCaches caches = new ReferenceCaches(0, 1000);

        caches.ensureObjectCapacityFor(12);

        assertThat(caches.objects().capacity()).isEqualTo(120);
    }

    @Test
    void objectCacheSizingIsCapped() {
        ReferenceCaches caches = new ReferenceCaches(0, 1000);

        caches.ensureObjectCapacityFor(10_000);

        assertThat(caches.objects().capacity()).isEqualTo(5000);
    }

    @Test
    void configuredCapacityIsKept() {
        ReferenceCaches caches = new ReferenceCaches(42, 1000);

        caches.ensureObjectCapacityFor(500);

        assertThat(caches.objects().capacity()).isEqualTo(42);
    }

    @Test
    void largerBatchGrowsHeuristicCapacity() {
        ReferenceCaches caches = new ReferenceCaches(0, 1000);

        caches.ensureObjectCapacityFor(3);
        caches.ensureObjectCapacityFor(300);

        assertThat(caches.objects().capacity()).isEqualTo(3000);
    }

    @Test
    void smallerBatchNeverShrinksHeuristicCapacity() {
        ReferenceCaches caches = new ReferenceCaches(0, 1000);

        caches.ensureObjectCapacityFor(300);
        caches.ensureObjectCapacityFor(3);

        assertThat(caches.objects().capacity()).isEqualTo(3000);
    }

    @Test
    void clearEmptiesBothCaches() {
        ReferenceCaches caches = new ReferenceCaches(10, 10);
        caches.objects().put("obj", "value");
        caches.fonts().put("Helvetica", FontMetrics.fromName("Helvetica"));

        caches.clear();

        assertThat(caches.objects().size()).isZero();
        assertThat(caches.fonts().size()).isZero();
    }
}
