package com.example.textengine.domain.model;

/**
 * Document-level information surfaced next to the extracted text.
 * Built by the PDFBox metadata reader from the document information dictionary.
 */
public record DocumentMetadata(
        String title,
        String author,
        String subject,
        String keywords,
        String creator,
        String producer,
        String creationDate,
        String modificationDate,
        int pageCount,
        String pdfVersion,
        boolean encrypted
) {
}
