package com.example.textengine.application.service;

import com.example.textengine.application.concurrent.CancellationToken;
import com.example.textengine.domain.model.CacheStats;
import com.example.textengine.domain.model.ExtractedPage;
import com.example.textengine.domain.model.ExtractionOptions;
import com.example.textengine.domain.model.PageManagerStats;
import com.example.textengine.domain.source.PositionedRunSource;
import com.example.textengine.infrastructure.cache.LruCache;

/**
 * Keeps a bounded number of decoded pages resident and extracts the others on demand.
 * Least recently requested pages are evicted first. Thread-safe.
 */
public class LazyPageManager {

    public static final int DEFAULT_RESIDENT_PAGES = 10;

    private final PositionedRunSource source;
    private final PageExtractor extractor;
    private final ExtractionOptions options;
    private final CancellationToken token;
    private final LruCache<Integer, ExtractedPage> residentPages;

    public LazyPageManager(PositionedRunSource source, PageExtractor extractor, ExtractionOptions options) {
        this(source, extractor, options, DEFAULT_RESIDENT_PAGES, CancellationToken.create());
    }

    /**
     * @param source       document to read
     * @param extractor    per-page extraction
     * @param options      ordering and rendering options for every page
     * @param maxResident  resident page bound, values below {@code 1} fall back to {@value #DEFAULT_RESIDENT_PAGES}
     * @param token        cancellation token consulted on every miss
     */
    public LazyPageManager(PositionedRunSource source, PageExtractor extractor, ExtractionOptions options,
                           int maxResident, CancellationToken token) {
        this.source = source;
        this.extractor = extractor;
        this.options = options == null ? ExtractionOptions.defaults() : options;
        this.token = token == null ? CancellationToken.create() : token;
        this.residentPages = new LruCache<>("resident-pages", maxResident > 0 ? maxResident : DEFAULT_RESIDENT_PAGES);
    }

    /**
     * Returns the page, extracting it when it is not resident.
     *
     * @param pageNumber 1-based page number
     * @return decoded page
     */
    public ExtractedPage getPage(int pageNumber) {
        return residentPages.getOrLoad(pageNumber, page -> extractor.extract(source, page, options, token));
    }

    public String getPageText(int pageNumber) {
        return getPage(pageNumber).text();
    }

    public boolean isResident(int pageNumber) {
        return residentPages.containsKey(pageNumber);
    }

    public PageManagerStats stats() {
        return new PageManagerStats(source.pageCount(), residentPages.size());
    }

    public CacheStats cacheStats() {
        return residentPages.stats();
    }

    /**
     * Drops every resident page.
     */
    public void clear() {
        residentPages.clear();
    }
}
