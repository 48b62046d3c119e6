package com.example.textengine.application.service;

import com.example.textengine.application.concurrent.CancellationToken;
import com.example.textengine.application.exception.ExtractionCancelledException;
import com.example.textengine.application.exception.UseCaseValidationException;
import com.example.textengine.domain.exception.PageScoped;
import com.example.textengine.domain.model.ExtractionOptions;
import com.example.textengine.domain.model.PageResult;
import com.example.textengine.domain.model.StyledPage;
import com.example.textengine.domain.model.StyledSegment;
import com.example.textengine.domain.source.PositionedRunSource;
import com.example.textengine.infrastructure.cache.ReferenceCaches;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Extracts many pages of one document in parallel.
 * <p>
 * A dispatcher feeds {@link ExtractionJob}s into a shared queue consumed by a fixed pool of workers; each
 * result lands in the slot of its request position, so output order always equals request order.
 * <p>
 * Failure policy: {@link #extractBatch}, {@link #extractBatchToString} and {@link #extractStyledBatch} are
 * all-or-nothing. The first page error stops dispatch, lets in-flight pages finish, discards every completed
 * result and is rethrown unchanged. {@link #extractBatchTolerant} instead reports failures per page.
 * Cancellation always aborts the call with {@link ExtractionCancelledException}.
 */
public class BatchExtractionService {

    private static final Logger log = LoggerFactory.getLogger(BatchExtractionService.class);
    private static final int MAX_DEFAULT_WORKERS = 4;

    private final PageExtractor pageExtractor;
    private final ReferenceCaches caches;
    private final String pageSeparator;
    private final AtomicInteger batchSequence = new AtomicInteger();

    /**
     * @param pageExtractor per-page extraction
     * @param caches        shared caches, sized from the requested page count when unset
     * @param pageSeparator text placed between pages by {@link #extractBatchToString}
     */
    public BatchExtractionService(PageExtractor pageExtractor, ReferenceCaches caches, String pageSeparator) {
        this.pageExtractor = pageExtractor;
        this.caches = caches;
        this.pageSeparator = Objects.requireNonNullElse(pageSeparator, "\n");
    }

    /**
     * Extracts the plain text of the requested pages.
     *
     * @param source      document to read
     * @param pageNumbers 1-based page numbers, duplicates allowed
     * @param options     worker count, extraction options and cancellation token
     * @return one successful result per requested page, in request order
     * @throws UseCaseValidationException   when the request is malformed
     * @throws ExtractionCancelledException when the token fires or the caller is interrupted
     */
    public List<PageResult> extractBatch(PositionedRunSource source, List<Integer> pageNumbers, BatchOptions options) {
        List<Slot<String>> slots = execute(source, pageNumbers, options, textTask(source, options), false);
        List<PageResult> results = new ArrayList<>(slots.size());
        for (Slot<String> slot : slots) {
            results.add(PageResult.success(slot.pageNumber(), slot.value()));
        }
        return results;
    }

    /**
     * Like {@link #extractBatch} but a failing page does not abort the call: its result carries the error.
     *
     * @return one result per requested page, in request order
     * @throws ExtractionCancelledException when the token fires or the caller is interrupted
     */
    public List<PageResult> extractBatchTolerant(PositionedRunSource source, List<Integer> pageNumbers,
                                                 BatchOptions options) {
        List<Slot<String>> slots = execute(source, pageNumbers, options, textTask(source, options), true);
        List<PageResult> results = new ArrayList<>(slots.size());
        for (Slot<String> slot : slots) {
            results.add(slot.failed()
                    ? PageResult.failure(slot.pageNumber(), slot.error())
                    : PageResult.success(slot.pageNumber(), slot.value()));
        }
        return results;
    }

    /**
     * @return texts of the requested pages in request order joined by the page separator
     */
    public String extractBatchToString(PositionedRunSource source, List<Integer> pageNumbers, BatchOptions options) {
        List<PageResult> results = extractBatch(source, pageNumbers, options);
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < results.size(); i++) {
            if (i > 0) {
                builder.append(pageSeparator);
            }
            builder.append(results.get(i).text());
        }
        return builder.toString();
    }

    /**
     * Extracts styled segments of the requested pages with the all-or-nothing policy.
     *
     * @return styled pages in request order
     */
    public List<StyledPage> extractStyledBatch(PositionedRunSource source, List<Integer> pageNumbers,
                                               BatchOptions options) {
        ExtractionOptions extraction = options == null ? ExtractionOptions.defaults() : options.extraction();
        CancellationToken token = options == null ? null : options.token();
        PageTask<List<StyledSegment>> task = page -> pageExtractor.extractStyled(source, page, extraction, token);
        List<Slot<List<StyledSegment>>> slots = execute(source, pageNumbers, options, task, false);
        List<StyledPage> pages = new ArrayList<>(slots.size());
        for (Slot<List<StyledSegment>> slot : slots) {
            pages.add(new StyledPage(slot.pageNumber(), slot.value()));
        }
        return pages;
    }

    private PageTask<String> textTask(PositionedRunSource source, BatchOptions options) {
        ExtractionOptions extraction = options == null ? ExtractionOptions.defaults() : options.extraction();
        CancellationToken token = options == null ? null : options.token();
        return page -> pageExtractor.extractText(source, page, extraction, token);
    }

    private <T> List<Slot<T>> execute(PositionedRunSource source, List<Integer> pageNumbers, BatchOptions options,
                                      PageTask<T> task, boolean tolerant) {
        validate(source, pageNumbers, options);
        if (pageNumbers.isEmpty()) {
            return List.of();
        }
        CancellationToken token = options.token();
        token.throwIfCancelled(PageScoped.NO_PAGE);

        caches.ensureObjectCapacityFor(pageNumbers.size());
        int workers = resolveWorkers(options.workers(), pageNumbers.size());
        long started = System.nanoTime();

        AtomicReferenceArray<Slot<T>> slots = new AtomicReferenceArray<>(pageNumbers.size());
        AtomicReference<RuntimeException> firstError = new AtomicReference<>();
        BlockingQueue<ExtractionJob> queue = new LinkedBlockingQueue<>();
        int batchId = batchSequence.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "text-batch-" + batchId + "-" + threadSequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<?>> futures = new ArrayList<>(workers);
            for (int w = 0; w < workers; w++) {
                futures.add(pool.submit(() -> {
                    work(queue, task, slots, firstError, token, tolerant);
                    return null;
                }));
            }
            int dispatched = 0;
            for (int i = 0; i < pageNumbers.size(); i++) {
                if (token.isCancelled() || (!tolerant && firstError.get() != null)) {
                    break;
                }
                queue.put(new ExtractionJob(pageNumbers.get(i), i));
                dispatched++;
            }
            for (int w = 0; w < workers; w++) {
                queue.put(ExtractionJob.STOP);
            }
            for (Future<?> future : futures) {
                future.get();
            }
            log.debug("Dispatched {} of {} page(s) to {} worker(s)", dispatched, pageNumbers.size(), workers);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            token.cancel();
            pool.shutdownNow();
            throw new ExtractionCancelledException("Batch extraction interrupted", ex);
        } catch (ExecutionException ex) {
            pool.shutdownNow();
            throw new IllegalStateException("Batch worker terminated unexpectedly", ex.getCause());
        } finally {
            pool.shutdown();
        }

        if (token.isCancelled()) {
            log.warn("Batch of {} page(s) cancelled", pageNumbers.size());
            throw new ExtractionCancelledException();
        }
        RuntimeException error = firstError.get();
        if (error != null) {
            log.warn("Batch of {} page(s) aborted: {}", pageNumbers.size(), error.getMessage());
            throw error;
        }

        List<Slot<T>> ordered = new ArrayList<>(pageNumbers.size());
        int failures = 0;
        for (int i = 0; i < pageNumbers.size(); i++) {
            Slot<T> slot = slots.get(i);
            if (slot.failed()) {
                failures++;
            }
            ordered.add(slot);
        }
        log.info("Extracted {} page(s) with {} worker(s) in {} ms ({} failed)", pageNumbers.size(), workers,
                (System.nanoTime() - started) / 1_000_000, failures);
        return ordered;
    }

    private static <T> void work(BlockingQueue<ExtractionJob> queue, PageTask<T> task,
                                 AtomicReferenceArray<Slot<T>> slots, AtomicReference<RuntimeException> firstError,
                                 CancellationToken token, boolean tolerant) throws InterruptedException {
        while (true) {
            ExtractionJob job = queue.take();
            if (job.isStop()) {
                return;
            }
            if (token.isCancelled() || (!tolerant && firstError.get() != null)) {
                continue;
            }
            try {
                slots.set(job.slot(), Slot.success(job.pageNumber(), task.extract(job.pageNumber())));
            } catch (ExtractionCancelledException ex) {
                if (token.isCancelled()) {
                    log.debug("Page {} stopped by cancellation", job.pageNumber());
                } else {
                    recordFailure(job, ex, slots, firstError, tolerant);
                }
            } catch (RuntimeException ex) {
                recordFailure(job, ex, slots, firstError, tolerant);
            }
        }
    }

    private static <T> void recordFailure(ExtractionJob job, RuntimeException ex, AtomicReferenceArray<Slot<T>> slots,
                                   AtomicReference<RuntimeException> firstError, boolean tolerant) {
        if (tolerant) {
            log.debug("Page {} failed: {}", job.pageNumber(), ex.getMessage());
            slots.set(job.slot(), Slot.failure(job.pageNumber(), ex));
        } else if (!firstError.compareAndSet(null, ex)) {
            log.debug("Page {} failed after the batch was already aborted: {}", job.pageNumber(), ex.getMessage());
        }
    }

    private static void validate(PositionedRunSource source, List<Integer> pageNumbers, BatchOptions options) {
        if (source == null) {
            throw new UseCaseValidationException("A document source is required");
        }
        if (pageNumbers == null) {
            throw new UseCaseValidationException("Page numbers are required");
        }
        for (Integer pageNumber : pageNumbers) {
            if (pageNumber == null) {
                throw new UseCaseValidationException("Page numbers must not contain null entries");
            }
        }
        if (options == null) {
            throw new UseCaseValidationException("Batch options are required");
        }
        if (options.workers() < 0) {
            throw new UseCaseValidationException("Worker count must not be negative but was " + options.workers());
        }
    }

    static int resolveWorkers(int requested, int pageCount) {
        int workers = requested > 0
                ? requested
                : Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_DEFAULT_WORKERS));
        return Math.min(workers, pageCount);
    }

    @FunctionalInterface
    private interface PageTask<T> {
        T extract(int pageNumber);
    }

    private record Slot<T>(int pageNumber, T value, RuntimeException error) {

        static <T> Slot<T> success(int pageNumber, T value) {
            return new Slot<>(pageNumber, value, null);
        }

        static <T> Slot<T> failure(int pageNumber, RuntimeException error) {
            return new Slot<>(pageNumber, null, error);
        }

        boolean failed() {
            return error != null;
        }
    }
}
