package com.example.textengine.application.service;

import com.example.textengine.application.concurrent.CancellationToken;
import com.example.textengine.application.exception.ApplicationException;
import com.example.textengine.application.exception.PageExtractionException;
import com.example.textengine.domain.exception.DomainException;
import com.example.textengine.domain.exception.InvalidPageNumberException;
import com.example.textengine.domain.exception.PageScoped;
import com.example.textengine.domain.layout.ReadingOrderReconstructor;
import com.example.textengine.domain.model.ExtractedPage;
import com.example.textengine.domain.model.ExtractionOptions;
import com.example.textengine.domain.model.FontMetrics;
import com.example.textengine.domain.model.Row;
import com.example.textengine.domain.model.RowGroup;
import com.example.textengine.domain.model.StyledSegment;
import com.example.textengine.domain.model.TextRun;
import com.example.textengine.domain.source.PositionedRunSource;
import com.example.textengine.infrastructure.buffer.ScratchBufferPool;
import com.example.textengine.infrastructure.cache.ReferenceCaches;
import com.example.textengine.infrastructure.exception.ResolutionException;
import com.example.textengine.infrastructure.exception.SourceUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Extracts one page: pulls its runs from the source, reconstructs reading order and renders plain text,
 * styled segments, or row groups.
 * <p>
 * Stateless apart from the shared caches and buffer pool it is given, so one instance serves every worker
 * of a batch. Failures are tagged with the page they occurred on: {@link SourceUnavailableException} is
 * propagated as is, font lookups fail with {@link ResolutionException}, any other collaborator failure is
 * wrapped in {@link PageExtractionException}.
 */
public class PageExtractor {

    private static final Logger log = LoggerFactory.getLogger(PageExtractor.class);
    private static final float MIN_WORD_GAP = 0.5f;
    private static final float WORD_GAP_FACTOR = 0.2f;

    private final ReadingOrderReconstructor reconstructor;
    private final ReferenceCaches caches;
    private final ScratchBufferPool bufferPool;

    /**
     * @param reconstructor reading-order algorithm
     * @param caches        shared object and font caches
     * @param bufferPool    scratch buffers used to assemble page text
     */
    public PageExtractor(ReadingOrderReconstructor reconstructor, ReferenceCaches caches, ScratchBufferPool bufferPool) {
        this.reconstructor = reconstructor;
        this.caches = caches;
        this.bufferPool = bufferPool;
    }

    /**
     * Extracts the ordered rows of a page together with its plain text.
     *
     * @param source     run source of the document
     * @param pageNumber 1-based page number
     * @param options    ordering and rendering options
     * @param token      cancellation token checked before fetching runs and before ordering
     * @return decoded page
     * @throws InvalidPageNumberException  when {@code pageNumber < 1}
     * @throws SourceUnavailableException  when the source cannot produce the page
     * @throws com.example.textengine.application.exception.ExtractionCancelledException when the token fired
     */
    public ExtractedPage extract(PositionedRunSource source, int pageNumber, ExtractionOptions options, CancellationToken token) {
        List<Row> rows = orderedRows(source, pageNumber, options, token);
        return new ExtractedPage(pageNumber, rows, render(rows, options));
    }

    /**
     * @return plain text of the page, rows separated by {@link ExtractionOptions#rowSeparator()}
     */
    public String extractText(PositionedRunSource source, int pageNumber, ExtractionOptions options, CancellationToken token) {
        return render(orderedRows(source, pageNumber, options, token), options);
    }

    /**
     * @return styled segments of the page in reading order
     */
    public List<StyledSegment> extractStyled(PositionedRunSource source, int pageNumber, ExtractionOptions options,
                                             CancellationToken token) {
        List<Row> rows = orderedRows(source, pageNumber, options, token);
        Function<String, FontMetrics> fonts = fontResolver(source, pageNumber);
        List<StyledSegment> segments = new ArrayList<>();
        for (Row row : rows) {
            for (TextRun run : row.runs()) {
                segments.add(toSegment(run, fonts));
            }
        }
        return segments;
    }

    /**
     * @return styled segments of the page grouped by row position
     */
    public List<RowGroup> extractRows(PositionedRunSource source, int pageNumber, ExtractionOptions options,
                                      CancellationToken token) {
        List<Row> rows = orderedRows(source, pageNumber, options, token);
        return toRowGroups(rows, fontResolver(source, pageNumber));
    }

    /**
     * Orders caller supplied runs without a source. Styles are inferred from font names.
     *
     * @param runs    runs of one page
     * @param options ordering and rendering options
     * @return ordered rows and text, reported as page {@code 0}
     */
    public ExtractedPage format(List<TextRun> runs, ExtractionOptions options) {
        List<Row> rows = reconstructor.orderRows(withoutEmptyRuns(runs), options.ordering());
        return new ExtractedPage(PageScoped.NO_PAGE, rows, render(rows, options));
    }

    /**
     * Groups already ordered rows into row groups, inferring styles from font names.
     *
     * @param rows ordered rows
     * @return row groups
     */
    public List<RowGroup> toRowGroups(List<Row> rows) {
        return toRowGroups(rows, FontMetrics::fromName);
    }

    /**
     * Renders ordered rows as plain text.
     *
     * @param rows    rows in reading order
     * @param options rendering options
     * @return text of the rows
     */
    public String render(List<Row> rows, ExtractionOptions options) {
        if (rows.isEmpty()) {
            return "";
        }
        try (ScratchBufferPool.Lease lease = bufferPool.acquire()) {
            StringBuilder builder = lease.buffer();
            for (int i = 0; i < rows.size(); i++) {
                if (i > 0) {
                    builder.append(options.rowSeparator());
                }
                appendRow(builder, rows.get(i), options.insertWordSpacing());
            }
            return builder.toString();
        }
    }

    private List<Row> orderedRows(PositionedRunSource source, int pageNumber, ExtractionOptions options,
                                  CancellationToken token) {
        if (pageNumber < 1) {
            throw new InvalidPageNumberException(pageNumber);
        }
        token.throwIfCancelled(pageNumber);
        List<TextRun> runs = withoutEmptyRuns(fetchRuns(source, pageNumber));
        token.throwIfCancelled(pageNumber);
        List<Row> rows = reconstructor.orderRows(runs, options.ordering());
        log.debug("Extracted page {} with {} runs in {} rows ({})", pageNumber, runs.size(), rows.size(), options.ordering());
        return rows;
    }

    private List<TextRun> fetchRuns(PositionedRunSource source, int pageNumber) {
        try {
            List<TextRun> runs = source.getRuns(pageNumber);
            if (runs == null) {
                throw new SourceUnavailableException(pageNumber, "Run source returned no content for page " + pageNumber);
            }
            return runs;
        } catch (SourceUnavailableException | ApplicationException | DomainException ex) {
            throw ex;
        } catch (ResolutionException ex) {
            throw ex.pageNumber() == PageScoped.NO_PAGE ? ex.onPage(pageNumber) : ex;
        } catch (RuntimeException ex) {
            throw new PageExtractionException(pageNumber, ex);
        }
    }

    private Function<String, FontMetrics> fontResolver(PositionedRunSource source, int pageNumber) {
        return fontRef -> {
            try {
                return caches.fonts().getOrLoad(fontRef, source::resolveFont);
            } catch (ResolutionException ex) {
                throw ex.pageNumber() == PageScoped.NO_PAGE ? ex.onPage(pageNumber) : ex;
            } catch (SourceUnavailableException | ApplicationException | DomainException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw new PageExtractionException(pageNumber, ex);
            }
        };
    }

    private List<RowGroup> toRowGroups(List<Row> rows, Function<String, FontMetrics> fonts) {
        List<RowGroup> groups = new ArrayList<>(rows.size());
        for (Row row : rows) {
            List<StyledSegment> segments = new ArrayList<>(row.runs().size());
            for (TextRun run : row.runs()) {
                segments.add(toSegment(run, fonts));
            }
            groups.add(new RowGroup(row.positionKey(), segments));
        }
        return groups;
    }

    private static StyledSegment toSegment(TextRun run, Function<String, FontMetrics> fonts) {
        FontMetrics metrics = fonts.apply(run.fontName());
        return new StyledSegment(run.fontName(), run.fontSize(), run.text(), metrics.bold(), metrics.italic());
    }

    private static void appendRow(StringBuilder builder, Row row, boolean insertWordSpacing) {
        TextRun previous = null;
        for (TextRun run : row.runs()) {
            if (insertWordSpacing && previous != null && needsSpace(previous, run)) {
                builder.append(' ');
            }
            builder.append(run.text());
            previous = run;
        }
    }

    private static boolean needsSpace(TextRun previous, TextRun next) {
        String left = previous.text();
        String right = next.text();
        if (Character.isWhitespace(left.charAt(left.length() - 1)) || Character.isWhitespace(right.charAt(0))) {
            return false;
        }
        float gap = next.x() - previous.endX();
        return gap > Math.max(next.fontSize() * WORD_GAP_FACTOR, MIN_WORD_GAP);
    }

    private static List<TextRun> withoutEmptyRuns(List<TextRun> runs) {
        if (runs == null || runs.isEmpty()) {
            return List.of();
        }
        List<TextRun> kept = new ArrayList<>(runs.size());
        for (TextRun run : runs) {
            if (run != null && !run.isEmpty()) {
                kept.add(run);
            }
        }
        return kept;
    }
}
