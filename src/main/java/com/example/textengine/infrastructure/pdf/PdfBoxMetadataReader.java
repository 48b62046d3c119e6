package com.example.textengine.infrastructure.pdf;

import com.example.textengine.domain.model.DocumentMetadata;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.List;

/**
 * Reads document metadata from the info dictionary, filling gaps from the XMP packet when one is present.
 */
@Component
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    /**
     * @param document already opened PDF document
     * @return metadata, or {@code null} when no document is given
     */
    public DocumentMetadata read(PDDocument document) {
        if (document == null) {
            return null;
        }
        PDDocumentInformation info = document.getDocumentInformation();
        XmpFields xmp = readXmp(document.getDocumentCatalog());

        return new DocumentMetadata(
                firstNonBlank(info != null ? info.getTitle() : null, xmp.title()),
                firstNonBlank(info != null ? info.getAuthor() : null, xmp.creators()),
                firstNonBlank(info != null ? info.getSubject() : null, xmp.description()),
                info != null ? info.getKeywords() : null,
                firstNonBlank(info != null ? info.getCreator() : null, xmp.creatorTool()),
                info != null ? info.getProducer() : null,
                firstNonBlank(info != null ? formatCalendar(info.getCreationDate()) : null, xmp.createDate()),
                firstNonBlank(info != null ? formatCalendar(info.getModificationDate()) : null, xmp.modifyDate()),
                document.getNumberOfPages(),
                String.valueOf(document.getVersion()),
                document.isEncrypted()
        );
    }

    private XmpFields readXmp(PDDocumentCatalog catalog) {
        PDMetadata pdMetadata = catalog != null ? catalog.getMetadata() : null;
        if (pdMetadata == null) {
            return XmpFields.EMPTY;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return XmpFields.EMPTY;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            XMPBasicSchema basic = xmp.getXMPBasicSchema();

            List<String> creators = dc != null && dc.getCreators() != null ? dc.getCreators() : List.of();
            return new XmpFields(
                    dc != null ? dc.getTitle() : null,
                    creators.isEmpty() ? null : String.join(", ", creators),
                    dc != null ? dc.getDescription() : null,
                    basic != null ? basic.getCreatorTool() : null,
                    basic != null ? formatCalendar(basic.getCreateDate()) : null,
                    basic != null ? formatCalendar(basic.getModifyDate()) : null
            );
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata, using the info dictionary only", ex);
            return XmpFields.EMPTY;
        }
    }

    private static String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return ISO_FORMATTER.format(calendar.toInstant().atOffset(ZoneOffset.UTC));
    }

    private static String firstNonBlank(String primary, String fallback) {
        return primary != null && !primary.isBlank() ? primary : fallback;
    }

    private record XmpFields(String title, String creators, String description, String creatorTool,
                             String createDate, String modifyDate) {

        static final XmpFields EMPTY = new XmpFields(null, null, null, null, null, null);
    }
}
