package com.example.textengine.application.service;

import com.example.textengine.application.concurrent.CancellationToken;
import com.example.textengine.domain.model.ExtractionOptions;
import com.example.textengine.domain.source.PositionedRunSource;

/**
 * Builds lazy page managers and page streams that share the configured extractor, options and resident bound.
 */
public class IncrementalExtractionFactory {

    private final PageExtractor pageExtractor;
    private final ExtractionOptions defaultOptions;
    private final int residentPages;

    /**
     * @param pageExtractor  per-page extraction shared with batch work
     * @param defaultOptions options used when a caller passes none
     * @param residentPages  resident page bound of every lazy page manager
     */
    public IncrementalExtractionFactory(PageExtractor pageExtractor, ExtractionOptions defaultOptions,
                                        int residentPages) {
        this.pageExtractor = pageExtractor;
        this.defaultOptions = defaultOptions == null ? ExtractionOptions.defaults() : defaultOptions;
        this.residentPages = residentPages;
    }

    public LazyPageManager lazyPages(PositionedRunSource source) {
        return lazyPages(source, null, null);
    }

    public LazyPageManager lazyPages(PositionedRunSource source, ExtractionOptions options, CancellationToken token) {
        return new LazyPageManager(source, pageExtractor, options == null ? defaultOptions : options,
                residentPages, token);
    }

    public StreamingTextExtractor stream(PositionedRunSource source) {
        return stream(source, null, null);
    }

    public StreamingTextExtractor stream(PositionedRunSource source, ExtractionOptions options,
                                         CancellationToken token) {
        return new StreamingTextExtractor(source, pageExtractor, options == null ? defaultOptions : options, token);
    }

    public int residentPages() {
        return residentPages;
    }
}
