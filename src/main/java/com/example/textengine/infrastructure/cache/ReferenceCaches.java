package com.example.textengine.infrastructure.cache;

import com.example.textengine.domain.model.FontMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoded-object and font-metric caches shared by every consumer of a run source.
 * Passed explicitly to sources and extractors; there is no process-wide instance.
 */
public class ReferenceCaches {

    private static final Logger log = LoggerFactory.getLogger(ReferenceCaches.class);

    static final int OBJECTS_PER_PAGE = 10;
    static final int MAX_OBJECT_CAPACITY = 5000;

    private final LruCache<String, Object> objects;
    private final LruCache<String, FontMetrics> fonts;
    private final boolean objectCapacityConfigured;

    /**
     * @param objectCapacity bound of the object cache, {@code <= 0} to size it from the batches it serves
     * @param fontCapacity   bound of the font cache, {@code <= 0} for unbounded
     */
    public ReferenceCaches(int objectCapacity, int fontCapacity) {
        this.objects = new LruCache<>("objects", objectCapacity);
        this.objectCapacityConfigured = objectCapacity > 0;
        this.fonts = new LruCache<>("fonts", fontCapacity);
    }

    public LruCache<String, Object> objects() {
        return objects;
    }

    public LruCache<String, FontMetrics> fonts() {
        return fonts;
    }

    /**
     * Bounds an unconfigured object cache in proportion to the work about to run:
     * {@code min(5000, pageCount * 10)}. A later, larger batch raises the bound; a smaller one never
     * shrinks it. An explicitly configured capacity is left untouched.
     *
     * @param pageCount number of pages about to be extracted
     */
    public void ensureObjectCapacityFor(int pageCount) {
        if (pageCount <= 0 || objectCapacityConfigured) {
            return;
        }
        int wanted = (int) Math.min(MAX_OBJECT_CAPACITY, (long) pageCount * OBJECTS_PER_PAGE);
        synchronized (objects) {
            int current = objects.capacity();
            if (current > 0 && current >= wanted) {
                return;
            }
            objects.capacity(wanted);
            log.debug("Object cache sized from {} to {} entries for {} page(s)", current, wanted, pageCount);
        }
    }

    public void clear() {
        objects.clear();
        fonts.clear();
    }
}
