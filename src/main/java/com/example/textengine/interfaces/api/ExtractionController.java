package com.example.textengine.interfaces.api;

import com.example.textengine.application.service.DocumentExtractionService;
import com.example.textengine.domain.model.DocumentExtractionResult;
import com.example.textengine.domain.model.ExtractionRequest;
import com.example.textengine.domain.model.OrderedRuns;
import com.example.textengine.domain.model.OrderingMode;
import com.example.textengine.domain.model.StyledExtractionResult;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Interfaces-layer REST controller exposing document extraction and run ordering.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class ExtractionController {

    private final DocumentExtractionService documentExtractionService;

    /**
     * @param documentExtractionService service responsible for loading and extracting documents
     */
    public ExtractionController(DocumentExtractionService documentExtractionService) {
        this.documentExtractionService = documentExtractionService;
    }

    /**
     * Extracts the plain text of an uploaded PDF.
     *
     * @param file     uploaded PDF
     * @param pages    1-based pages to extract, every page when absent
     * @param ordering {@code simple} or {@code smart}
     * @param workers  batch worker count
     * @param tolerant report failing pages inside the result instead of failing the request
     * @return JSON response containing the extraction result
     */
    @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentExtractionResult> extract(@RequestParam("file") MultipartFile file,
                                                            @RequestParam(value = "pages", required = false) List<Integer> pages,
                                                            @RequestParam(value = "ordering", required = false) String ordering,
                                                            @RequestParam(value = "workers", required = false) Integer workers,
                                                            @RequestParam(value = "tolerant", defaultValue = "false") boolean tolerant) {
        ExtractionRequest request = new ExtractionRequest(pages, OrderingMode.fromString(ordering, null), workers, tolerant);
        return ResponseEntity.ok(documentExtractionService.extract(file, request));
    }

    /**
     * Extracts styled segments of an uploaded PDF.
     */
    @PostMapping(value = "/extract/styled", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<StyledExtractionResult> extractStyled(@RequestParam("file") MultipartFile file,
                                                                @RequestParam(value = "pages", required = false) List<Integer> pages,
                                                                @RequestParam(value = "ordering", required = false) String ordering,
                                                                @RequestParam(value = "workers", required = false) Integer workers) {
        ExtractionRequest request = new ExtractionRequest(pages, OrderingMode.fromString(ordering, null), workers, false);
        return ResponseEntity.ok(documentExtractionService.extractStyled(file, request));
    }

    /**
     * Orders caller supplied runs of one page.
     */
    @PostMapping(value = "/order", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderedRuns> order(@RequestBody OrderRunsRequest body) {
        OrderedRuns result = documentExtractionService.orderRuns(body.runs(), OrderingMode.fromString(body.ordering(), null));
        return ResponseEntity.ok(result);
    }
}
