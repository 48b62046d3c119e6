package com.example.textengine.domain.model;

import java.util.List;

/**
 * Plain-text extraction of a document.
 *
 * @param fileName  name of the processed file
 * @param pageCount pages in the document
 * @param ordering  reading-order strategy that was applied
 * @param metadata  document metadata
 * @param pages     per-page results in request order
 * @param text      texts of the successful pages joined by the page separator
 */
public record DocumentExtractionResult(
        String fileName,
        int pageCount,
        OrderingMode ordering,
        DocumentMetadata metadata,
        List<PageResult> pages,
        String text
) {
}
