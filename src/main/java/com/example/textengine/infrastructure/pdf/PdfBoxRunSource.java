package com.example.textengine.infrastructure.pdf;

import com.example.textengine.domain.model.FontMetrics;
import com.example.textengine.domain.model.TextRun;
import com.example.textengine.domain.source.PositionedRunSource;
import com.example.textengine.infrastructure.cache.ReferenceCaches;
import com.example.textengine.infrastructure.exception.DocumentProcessingException;
import com.example.textengine.infrastructure.exception.ResolutionException;
import com.example.textengine.infrastructure.exception.SourceUnavailableException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSNull;
import org.apache.pdfbox.cos.COSObjectKey;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link PositionedRunSource} backed by a PDFBox {@link PDDocument}.
 * <p>
 * PDFBox documents are not thread-safe, so every access to the document is serialized on one lock.
 * Decoded runs and resolved objects are memoized in the shared object cache under keys private to
 * this source, which keeps concurrent workers from decoding the same page twice.
 */
public class PdfBoxRunSource implements PositionedRunSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxRunSource.class);
    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final Pattern OBJECT_REFERENCE = Pattern.compile("\\s*(\\d+)\\s+(\\d+)(?:\\s+R)?\\s*");

    private final PDDocument document;
    private final ReferenceCaches caches;
    private final String keyPrefix;
    private final int pageCount;
    private final Object documentLock = new Object();
    private final Map<String, PDFont> fonts = new ConcurrentHashMap<>();

    /**
     * @param document opened document; closed by {@link #close()}
     * @param caches   caches receiving decoded runs and objects
     */
    public PdfBoxRunSource(PDDocument document, ReferenceCaches caches) {
        this.document = document;
        this.caches = caches;
        this.keyPrefix = "pdf#" + SEQUENCE.incrementAndGet() + ":";
        this.pageCount = document.getNumberOfPages();
    }

    /**
     * Loads a document from memory.
     *
     * @throws DocumentProcessingException when PDFBox cannot parse the bytes
     */
    public static PdfBoxRunSource load(byte[] bytes, ReferenceCaches caches) {
        try {
            return new PdfBoxRunSource(Loader.loadPDF(bytes), caches);
        } catch (IOException ex) {
            throw new DocumentProcessingException("Failed to load PDF document", ex);
        }
    }

    /**
     * Loads a document from disk.
     *
     * @throws DocumentProcessingException when the file cannot be read or parsed
     */
    public static PdfBoxRunSource load(Path path, ReferenceCaches caches) {
        try {
            return new PdfBoxRunSource(Loader.loadPDF(Files.readAllBytes(path)), caches);
        } catch (IOException ex) {
            throw new DocumentProcessingException("Failed to load PDF document " + path.getFileName(), ex);
        }
    }

    @Override
    public int pageCount() {
        return pageCount;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<TextRun> getRuns(int pageNumber) {
        if (pageNumber < 1 || pageNumber > pageCount) {
            throw new SourceUnavailableException(pageNumber,
                    "Page " + pageNumber + " is outside the document (1.." + pageCount + ")");
        }
        String key = keyPrefix + "runs:" + pageNumber;
        Object cached = caches.objects().get(key);
        if (cached instanceof List<?> list) {
            return (List<TextRun>) list;
        }
        List<TextRun> runs = decodePage(pageNumber);
        caches.objects().put(key, runs);
        return runs;
    }

    @Override
    public FontMetrics resolveFont(String fontRef) {
        PDFont font = fonts.get(fontRef);
        if (font == null) {
            throw new ResolutionException(fontRef, "Font not found: " + fontRef);
        }
        synchronized (documentLock) {
            return toMetrics(fontRef, font);
        }
    }

    /**
     * Resolves an indirect object given as {@code "num gen"} or {@code "num gen R"}.
     *
     * @throws ResolutionException when the reference is malformed or absent from the cross-reference table
     */
    @Override
    public Object resolveObject(String ref) {
        Matcher matcher = OBJECT_REFERENCE.matcher(ref == null ? "" : ref);
        if (!matcher.matches()) {
            throw new ResolutionException(ref, "Malformed object reference: " + ref);
        }
        long number = Long.parseLong(matcher.group(1));
        int generation = Integer.parseInt(matcher.group(2));
        return caches.objects().getOrLoad(keyPrefix + "obj:" + number + " " + generation,
                key -> loadObject(ref, new COSObjectKey(number, generation)));
    }

    @Override
    public void close() {
        synchronized (documentLock) {
            try {
                document.close();
            } catch (IOException ex) {
                log.warn("Failed to close PDF document", ex);
            }
        }
    }

    private List<TextRun> decodePage(int pageNumber) {
        synchronized (documentLock) {
            try {
                RunCapturingStripper stripper = new RunCapturingStripper();
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                stripper.getText(document);
                for (PDFont font : stripper.fonts()) {
                    fonts.putIfAbsent(RunCapturingStripper.fontKey(font), font);
                }
                List<TextRun> runs = stripper.runs();
                log.debug("Decoded {} run(s) on page {}", runs.size(), pageNumber);
                return runs;
            } catch (IOException | RuntimeException ex) {
                throw new SourceUnavailableException(pageNumber, "Failed to decode page " + pageNumber, ex);
            }
        }
    }

    private Object loadObject(String ref, COSObjectKey key) {
        synchronized (documentLock) {
            if (!document.getDocument().getXrefTable().containsKey(key)) {
                throw new ResolutionException(ref, "Object not found: " + ref);
            }
            COSBase base = document.getDocument().getObjectFromPool(key).getObject();
            if (base == null || base == COSNull.NULL) {
                throw new ResolutionException(ref, "Object resolves to null: " + ref);
            }
            return base;
        }
    }

    private static FontMetrics toMetrics(String fontRef, PDFont font) {
        PDFontDescriptor descriptor = font.getFontDescriptor();
        float ascent = descriptor != null ? descriptor.getAscent() : 0f;
        float descent = descriptor != null ? descriptor.getDescent() : 0f;
        boolean bold = FontMetrics.nameLooksBold(fontRef)
                || (descriptor != null && (descriptor.isForceBold() || descriptor.getFontWeight() >= 700f));
        boolean italic = FontMetrics.nameLooksItalic(fontRef) || (descriptor != null && descriptor.isItalic());
        return new FontMetrics(fontRef, ascent, descent, font.getAverageFontWidth(), bold, italic);
    }
}
