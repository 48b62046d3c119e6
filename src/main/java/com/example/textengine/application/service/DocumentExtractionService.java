package com.example.textengine.application.service;

import com.example.textengine.application.exception.UseCaseValidationException;
import com.example.textengine.domain.exception.DocumentNotFoundException;
import com.example.textengine.domain.exception.InvalidDocumentException;
import com.example.textengine.domain.model.DocumentExtractionResult;
import com.example.textengine.domain.model.DocumentMetadata;
import com.example.textengine.domain.model.ExtractedPage;
import com.example.textengine.domain.model.ExtractionOptions;
import com.example.textengine.domain.model.ExtractionRequest;
import com.example.textengine.domain.model.OrderedRuns;
import com.example.textengine.domain.model.OrderingMode;
import com.example.textengine.domain.model.PageResult;
import com.example.textengine.domain.model.StyledExtractionResult;
import com.example.textengine.domain.model.StyledPage;
import com.example.textengine.domain.model.TextRun;
import com.example.textengine.infrastructure.cache.ReferenceCaches;
import com.example.textengine.infrastructure.config.ExtractionProperties;
import com.example.textengine.infrastructure.exception.DocumentProcessingException;
import com.example.textengine.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.textengine.infrastructure.pdf.PdfBoxRunSource;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application service that loads PDF documents and runs them through the extraction engine.
 * Validates the input, owns the document life cycle and applies the configured defaults to each request.
 */
@Service
public class DocumentExtractionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentExtractionService.class);

    private final BatchExtractionService batchExtractionService;
    private final PageExtractor pageExtractor;
    private final ReferenceCaches caches;
    private final PdfBoxMetadataReader metadataReader;
    private final ExtractionProperties properties;

    /**
     * @param batchExtractionService parallel page extraction
     * @param pageExtractor          ordering of caller supplied runs
     * @param caches                 caches shared by every loaded document
     * @param metadataReader         metadata mapping
     * @param properties             configured defaults
     */
    public DocumentExtractionService(BatchExtractionService batchExtractionService, PageExtractor pageExtractor,
                                     ReferenceCaches caches, PdfBoxMetadataReader metadataReader,
                                     ExtractionProperties properties) {
        this.batchExtractionService = batchExtractionService;
        this.pageExtractor = pageExtractor;
        this.caches = caches;
        this.metadataReader = metadataReader;
        this.properties = properties;
    }

    /**
     * Extracts plain text from an uploaded PDF.
     *
     * @param file    uploaded file
     * @param request pages, ordering and batch settings
     * @return extraction result
     * @throws InvalidDocumentException    when the file is missing or not a PDF
     * @throws DocumentProcessingException when PDFBox cannot read the bytes
     */
    public DocumentExtractionResult extract(MultipartFile file, ExtractionRequest request) {
        return extract(readUpload(file), resolveFileName(file), request);
    }

    /**
     * Extracts plain text from a PDF on disk.
     *
     * @throws DocumentNotFoundException when the path does not exist
     */
    public DocumentExtractionResult extract(Path path, ExtractionRequest request) {
        return extract(readPath(path), resolveFileName(path), request);
    }

    /**
     * Extracts styled segments from an uploaded PDF.
     */
    public StyledExtractionResult extractStyled(MultipartFile file, ExtractionRequest request) {
        return extractStyled(readUpload(file), resolveFileName(file), request);
    }

    public StyledExtractionResult extractStyled(Path path, ExtractionRequest request) {
        return extractStyled(readPath(path), resolveFileName(path), request);
    }

    /**
     * Orders runs supplied by the caller, without any document.
     *
     * @param runs     runs of one page
     * @param ordering strategy, {@code null} for the configured default
     * @return ordered text and row groups
     */
    public OrderedRuns orderRuns(List<TextRun> runs, OrderingMode ordering) {
        ExtractionOptions options = options(ordering);
        ExtractedPage page = pageExtractor.format(runs, options);
        return new OrderedRuns(options.ordering(), page.text(), pageExtractor.toRowGroups(page.rows()));
    }

    private DocumentExtractionResult extract(byte[] bytes, String fileName, ExtractionRequest request) {
        ExtractionRequest effective = request == null ? ExtractionRequest.allPages() : request;
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PdfBoxRunSource source = new PdfBoxRunSource(document, caches);
            DocumentMetadata metadata = metadataReader.read(document);
            List<Integer> pages = resolvePages(effective, source.pageCount());
            BatchOptions batchOptions = batchOptions(effective);

            List<PageResult> results = effective.tolerant()
                    ? batchExtractionService.extractBatchTolerant(source, pages, batchOptions)
                    : batchExtractionService.extractBatch(source, pages, batchOptions);
            log.info("Extracted {} page(s) of {} ({} ordering)", results.size(), fileName,
                    batchOptions.extraction().ordering());
            return new DocumentExtractionResult(fileName, source.pageCount(), batchOptions.extraction().ordering(),
                    metadata, results, joinSuccessful(results));
        } catch (IOException ex) {
            throw new DocumentProcessingException("Unable to process the PDF document " + fileName, ex);
        }
    }

    private StyledExtractionResult extractStyled(byte[] bytes, String fileName, ExtractionRequest request) {
        ExtractionRequest effective = request == null ? ExtractionRequest.allPages() : request;
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PdfBoxRunSource source = new PdfBoxRunSource(document, caches);
            BatchOptions batchOptions = batchOptions(effective);
            List<StyledPage> pages = batchExtractionService.extractStyledBatch(source,
                    resolvePages(effective, source.pageCount()), batchOptions);
            log.info("Extracted styled text of {} page(s) of {}", pages.size(), fileName);
            return new StyledExtractionResult(fileName, source.pageCount(), batchOptions.extraction().ordering(), pages);
        } catch (IOException ex) {
            throw new DocumentProcessingException("Unable to process the PDF document " + fileName, ex);
        }
    }

    private ExtractionOptions options(OrderingMode ordering) {
        ExtractionOptions defaults = properties.extractionOptions();
        return ordering == null ? defaults : defaults.withOrdering(ordering);
    }

    private BatchOptions batchOptions(ExtractionRequest request) {
        int workers = request.workers() != null ? request.workers() : properties.workers();
        if (workers < 0) {
            throw new UseCaseValidationException("Worker count must not be negative but was " + workers);
        }
        return new BatchOptions(workers, options(request.ordering()), null);
    }

    private String joinSuccessful(List<PageResult> results) {
        List<String> texts = new ArrayList<>(results.size());
        for (PageResult result : results) {
            if (result.succeeded()) {
                texts.add(result.text());
            }
        }
        return String.join(properties.pageSeparator(), texts);
    }

    private static List<Integer> resolvePages(ExtractionRequest request, int pageCount) {
        if (!request.pages().isEmpty()) {
            return request.pages();
        }
        List<Integer> pages = new ArrayList<>(pageCount);
        for (int page = 1; page <= pageCount; page++) {
            pages.add(page);
        }
        return pages;
    }

    private static byte[] readUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidDocumentException("Please choose a PDF file to upload.");
        }
        if (!looksLikePdf(file)) {
            throw InvalidDocumentException.unsupportedFormat(file.getOriginalFilename());
        }
        try {
            return file.getBytes();
        } catch (IOException ex) {
            throw new DocumentProcessingException("Unable to read the uploaded PDF file.", ex);
        }
    }

    private static byte[] readPath(Path path) {
        if (path == null) {
            throw new InvalidDocumentException("PDF path is required.");
        }
        if (!Files.exists(path)) {
            throw new DocumentNotFoundException(path.toAbsolutePath().toString());
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new DocumentProcessingException("Unable to read the PDF at " + path, ex);
        }
    }

    private static boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private static String resolveFileName(MultipartFile file) {
        String fileName = file != null ? file.getOriginalFilename() : null;
        return fileName == null || fileName.isBlank() ? "uploaded.pdf" : fileName;
    }

    private static String resolveFileName(Path path) {
        return path != null && path.getFileName() != null ? path.getFileName().toString() : "document.pdf";
    }
}
