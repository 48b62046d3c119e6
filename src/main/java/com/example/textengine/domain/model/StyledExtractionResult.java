package com.example.textengine.domain.model;

import java.util.List;

/**
 * Styled extraction of a document.
 *
 * @param fileName  name of the processed file
 * @param pageCount pages in the document
 * @param ordering  reading-order strategy that was applied
 * @param pages     styled pages in request order
 */
public record StyledExtractionResult(String fileName, int pageCount, OrderingMode ordering, List<StyledPage> pages) {
}
