package com.example.textengine.application.service;

import com.example.textengine.application.exception.UseCaseValidationException;
import com.example.textengine.domain.exception.DocumentNotFoundException;
import com.example.textengine.domain.exception.InvalidDocumentException;
import com.example.textengine.domain.layout.ReadingOrderReconstructor;
import com.example.textengine.domain.model.DocumentExtractionResult;
import com.example.textengine.domain.model.ExtractionRequest;
import com.example.textengine.domain.model.OrderedRuns;
import com.example.textengine.domain.model.OrderingMode;
import com.example.textengine.domain.model.PageResult;
import com.example.textengine.domain.model.StyledExtractionResult;
import com.example.textengine.domain.model.TextRun;
import com.example.textengine.infrastructure.buffer.ScratchBufferPool;
import com.example.textengine.infrastructure.cache.ReferenceCaches;
import com.example.textengine.infrastructure.config.ExtractionProperties;
import com.example.textengine.infrastructure.exception.DocumentProcessingException;
import com.example.textengine.infrastructure.exception.SourceUnavailableException;
import com.example.textengine.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.textengine.support.PdfFixtures;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests covering the document extraction application service.
 */
class DocumentExtractionServiceTest {

    private final ExtractionProperties properties =
            new ExtractionProperties(0, OrderingMode.SIMPLE, 0, 1000, 10, "\n", "\n", false, 8);
    private final ReferenceCaches caches = new ReferenceCaches(0, 1000);
    private final PageExtractor pageExtractor =
            new PageExtractor(new ReadingOrderReconstructor(), caches, new ScratchBufferPool(8));
    private final DocumentExtractionService service = new DocumentExtractionService(
            new BatchExtractionService(pageExtractor, caches, properties.pageSeparator()),
            pageExtractor, caches, new PdfBoxMetadataReader(), properties);

    /**
     * Verifies that every page is extracted when no pages are requested.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void extractReturnsEveryPage() throws Exception {
        MockMultipartFile file = pdfUpload(PdfFixtures.pages("First page", "Second page"));

        DocumentExtractionResult result = service.extract(file, ExtractionRequest.allPages());

        assertThat(result.fileName()).isEqualTo("sample.pdf");
        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(result.ordering()).isEqualTo(OrderingMode.SIMPLE);
        assertThat(result.metadata()).isNotNull();
        assertThat(result.pages()).extracting(PageResult::pageNumber).containsExactly(1, 2);
        assertThat(result.text()).contains("First page").contains("Second page");
        assertThat(result.text().indexOf("First page")).isLessThan(result.text().indexOf("Second page"));
    }

    @Test
    void requestedPagesAreExtractedInRequestOrder() throws Exception {
        MockMultipartFile file = pdfUpload(PdfFixtures.pages("one", "two", "three"));

        DocumentExtractionResult result = service.extract(file,
                new ExtractionRequest(List.of(3, 1), OrderingMode.SMART, 2, false));

        assertThat(result.ordering()).isEqualTo(OrderingMode.SMART);
        assertThat(result.pages()).extracting(PageResult::pageNumber).containsExactly(3, 1);
        assertThat(result.pages().get(0).text()).contains("three");
    }

    @Test
    void missingPageFailsTheRequestUnlessTolerant() throws Exception {
        byte[] pdf = PdfFixtures.pages("only");

        assertThatThrownBy(() -> service.extract(pdfUpload(pdf), new ExtractionRequest(List.of(1, 5), null, null, false)))
                .isInstanceOf(SourceUnavailableException.class);

        DocumentExtractionResult tolerant = service.extract(pdfUpload(pdf),
                new ExtractionRequest(List.of(1, 5), null, null, true));

        assertThat(tolerant.pages()).extracting(PageResult::succeeded).containsExactly(true, false);
        assertThat(tolerant.text()).contains("only");
    }

    @Test
    void negativeWorkersAreRejected() throws Exception {
        MockMultipartFile file = pdfUpload(PdfFixtures.pages("one"));

        assertThrows(UseCaseValidationException.class,
                () -> service.extract(file, new ExtractionRequest(List.of(), null, -2, false)));
    }

    @Test
    void styledExtractionReportsFonts() throws Exception {
        MockMultipartFile file = pdfUpload(PdfFixtures.pages("Styled"));

        StyledExtractionResult result = service.extractStyled(file, ExtractionRequest.allPages());

        assertThat(result.pages()).hasSize(1);
        assertThat(result.pages().get(0).segments()).isNotEmpty();
        assertThat(result.pages().get(0).segments().get(0).fontName()).isEqualTo("Helvetica");
    }

    @Test
    void extractRejectsNonPdf() {
        MockMultipartFile file = new MockMultipartFile("file", "note.txt", "text/plain",
                "plain text".getBytes(StandardCharsets.UTF_8));

        assertThrows(InvalidDocumentException.class, () -> service.extract(file, ExtractionRequest.allPages()));
    }

    @Test
    void extractRejectsEmptyUpload() {
        MockMultipartFile file = new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);

        assertThrows(InvalidDocumentException.class, () -> service.extract(file, ExtractionRequest.allPages()));
    }

    @Test
    void corruptPdfIsAProcessingFailure() {
        MockMultipartFile file = new MockMultipartFile("file", "broken.pdf", "application/pdf",
                "definitely not a pdf".getBytes(StandardCharsets.UTF_8));

        assertThrows(DocumentProcessingException.class, () -> service.extract(file, ExtractionRequest.allPages()));
    }

    @Test
    void extractFromPath(@TempDir Path tempDir) throws Exception {
        Path pdf = tempDir.resolve("disk.pdf");
        Files.write(pdf, PdfFixtures.pages("On disk"));

        DocumentExtractionResult result = service.extract(pdf, ExtractionRequest.allPages());

        assertThat(result.fileName()).isEqualTo("disk.pdf");
        assertThat(result.text()).contains("On disk");
    }

    @Test
    void missingPathIsNotFound(@TempDir Path tempDir) {
        assertThrows(DocumentNotFoundException.class,
                () -> service.extract(tempDir.resolve("missing.pdf"), ExtractionRequest.allPages()));
    }

    @Test
    void orderRunsUsesConfiguredDefaultOrdering() {
        OrderedRuns ordered = service.orderRuns(List.of(
                new TextRun(0f, 10f, 0f, "F1", "A"),
                new TextRun(5f, 10f, 0f, "F1", "B"),
                new TextRun(0f, 0f, 0f, "F1", "C")
        ), null);

        assertThat(ordered.ordering()).isEqualTo(OrderingMode.SIMPLE);
        assertThat(ordered.text()).isEqualTo("AB\nC");
        assertThat(ordered.rows()).hasSize(2);
    }

    private static MockMultipartFile pdfUpload(byte[] bytes) {
        return new MockMultipartFile("file", "sample.pdf", "application/pdf", bytes);
    }
}
