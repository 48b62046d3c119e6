package com.example.textengine.support;

import com.example.textengine.domain.model.FontMetrics;
import com.example.textengine.domain.model.TextRun;
import com.example.textengine.domain.source.PositionedRunSource;
import com.example.textengine.infrastructure.exception.ResolutionException;
import com.example.textengine.infrastructure.exception.SourceUnavailableException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run source over pages held in memory, with hooks to fail, slow down or count page requests.
 */
public class InMemoryRunSource implements PositionedRunSource {

    private final List<List<TextRun>> pages;
    private final Map<Integer, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<Integer, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final Map<Integer, AtomicInteger> requests = new ConcurrentHashMap<>();
    private final Map<String, FontMetrics> fonts = new HashMap<>();
    private final AtomicInteger fontLookups = new AtomicInteger();

    private InMemoryRunSource(List<List<TextRun>> pages) {
        this.pages = pages;
    }

    @SafeVarargs
    public static InMemoryRunSource of(List<TextRun>... pages) {
        List<List<TextRun>> copy = new ArrayList<>();
        for (List<TextRun> page : pages) {
            copy.add(List.copyOf(page));
        }
        return new InMemoryRunSource(copy);
    }

    /**
     * Builds a document whose page {@code n} holds a single run with text {@code "page n"}.
     */
    public static InMemoryRunSource numberedPages(int pageCount) {
        List<List<TextRun>> pages = new ArrayList<>();
        for (int page = 1; page <= pageCount; page++) {
            pages.add(List.of(new TextRun(10f, 700f, 12f, "Helvetica", "page " + page)));
        }
        return new InMemoryRunSource(pages);
    }

    public InMemoryRunSource failOn(int pageNumber, RuntimeException failure) {
        failures.put(pageNumber, failure);
        return this;
    }

    /**
     * Makes requests for the page block until the returned latch is released.
     */
    public CountDownLatch holdPage(int pageNumber) {
        CountDownLatch latch = new CountDownLatch(1);
        gates.put(pageNumber, latch);
        return latch;
    }

    public InMemoryRunSource withFont(FontMetrics metrics) {
        fonts.put(metrics.name(), metrics);
        return this;
    }

    public int requestsFor(int pageNumber) {
        AtomicInteger count = requests.get(pageNumber);
        return count == null ? 0 : count.get();
    }

    public int totalRequests() {
        int total = 0;
        for (AtomicInteger count : requests.values()) {
            total += count.get();
        }
        return total;
    }

    public int fontLookups() {
        return fontLookups.get();
    }

    @Override
    public int pageCount() {
        return pages.size();
    }

    @Override
    public List<TextRun> getRuns(int pageNumber) {
        requests.computeIfAbsent(pageNumber, key -> new AtomicInteger()).incrementAndGet();
        CountDownLatch gate = gates.get(pageNumber);
        if (gate != null) {
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Page " + pageNumber + " was never released");
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while holding page " + pageNumber, ex);
            }
        }
        RuntimeException failure = failures.get(pageNumber);
        if (failure != null) {
            throw failure;
        }
        if (pageNumber < 1 || pageNumber > pages.size()) {
            throw new SourceUnavailableException(pageNumber, "No page " + pageNumber);
        }
        return pages.get(pageNumber - 1);
    }

    @Override
    public FontMetrics resolveFont(String fontRef) {
        fontLookups.incrementAndGet();
        FontMetrics metrics = fonts.get(fontRef);
        return metrics != null ? metrics : FontMetrics.fromName(fontRef);
    }

    @Override
    public Object resolveObject(String ref) {
        throw new ResolutionException(ref, "No objects in memory source");
    }
}
