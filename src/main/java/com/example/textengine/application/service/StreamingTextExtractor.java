package com.example.textengine.application.service;

import com.example.textengine.application.concurrent.CancellationToken;
import com.example.textengine.application.exception.StreamExhaustedException;
import com.example.textengine.application.exception.UseCaseValidationException;
import com.example.textengine.domain.model.ExtractionOptions;
import com.example.textengine.domain.model.StreamedPage;
import com.example.textengine.domain.source.PositionedRunSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands out the pages of a document one at a time, in page order.
 * <p>
 * A page error propagates from {@link #next()} and leaves the cursor on the failing page: calling
 * {@code next()} again retries it, {@link #skip()} moves past it. Pages are never skipped silently.
 * Progress counts consumed pages, emitted or skipped, and only moves backwards on {@link #reset()}.
 * <p>
 * All methods are synchronized; one stream is meant to be consumed by one reader at a time.
 */
public class StreamingTextExtractor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamingTextExtractor.class);

    private final PositionedRunSource source;
    private final PageExtractor extractor;
    private final ExtractionOptions options;
    private final CancellationToken token;
    private final int totalPages;

    private int cursor;
    private StreamState state = StreamState.IDLE;
    private boolean closed;

    public StreamingTextExtractor(PositionedRunSource source, PageExtractor extractor, ExtractionOptions options) {
        this(source, extractor, options, CancellationToken.create());
    }

    public StreamingTextExtractor(PositionedRunSource source, PageExtractor extractor, ExtractionOptions options,
                                  CancellationToken token) {
        this.source = source;
        this.extractor = extractor;
        this.options = options == null ? ExtractionOptions.defaults() : options;
        this.token = token == null ? CancellationToken.create() : token;
        this.totalPages = Math.max(0, source.pageCount());
    }

    /**
     * Emits the next page.
     *
     * @return the page with {@code hasMore == false} on the last one
     * @throws StreamExhaustedException when every page was consumed or the stream is closed
     */
    public synchronized StreamedPage next() {
        ensureOpenCursor();
        int pageNumber = cursor + 1;
        String text = extractor.extractText(source, pageNumber, options, token);
        cursor++;
        boolean hasMore = cursor < totalPages;
        state = hasMore ? StreamState.EMITTING : StreamState.DONE;
        return new StreamedPage(pageNumber, text, hasMore);
    }

    /**
     * Emits up to {@code count} pages. When a page fails after at least one page was emitted the pages
     * emitted so far are returned and the failure surfaces on the next call.
     *
     * @param count maximum number of pages, must be positive
     * @return between one and {@code count} pages
     * @throws StreamExhaustedException when nothing is left to emit
     */
    public synchronized List<StreamedPage> nextBatch(int count) {
        if (count <= 0) {
            throw new UseCaseValidationException("Batch size must be positive but was " + count);
        }
        List<StreamedPage> pages = new ArrayList<>(Math.min(count, Math.max(1, totalPages - cursor)));
        pages.add(next());
        while (pages.size() < count && state != StreamState.DONE) {
            try {
                pages.add(next());
            } catch (RuntimeException ex) {
                log.debug("Stopping batch before page {}: {}", cursor + 1, ex.getMessage());
                break;
            }
        }
        return pages;
    }

    /**
     * Moves past the current page without extracting it.
     *
     * @return number of the skipped page
     * @throws StreamExhaustedException when nothing is left to skip
     */
    public synchronized int skip() {
        ensureOpenCursor();
        int skipped = ++cursor;
        state = cursor < totalPages ? StreamState.EMITTING : StreamState.DONE;
        log.debug("Skipped page {}", skipped);
        return skipped;
    }

    /**
     * @return consumed fraction in {@code [0, 1]}, {@code 1} for a document without pages
     */
    public synchronized float progress() {
        if (totalPages == 0) {
            return 1.0f;
        }
        return (float) cursor / totalPages;
    }

    /**
     * Rewinds to the first page.
     *
     * @throws IllegalStateException when the stream is closed
     */
    public synchronized void reset() {
        if (closed) {
            throw new IllegalStateException("Stream is closed");
        }
        cursor = 0;
        state = StreamState.IDLE;
    }

    public synchronized StreamState state() {
        return state;
    }

    public int totalPages() {
        return totalPages;
    }

    /**
     * Ends the stream. The source stays open; it belongs to the caller.
     */
    @Override
    public synchronized void close() {
        closed = true;
        state = StreamState.DONE;
    }

    private void ensureOpenCursor() {
        if (state == StreamState.DONE) {
            throw new StreamExhaustedException(totalPages);
        }
        if (cursor >= totalPages) {
            state = StreamState.DONE;
            throw new StreamExhaustedException(totalPages);
        }
    }
}
