package com.example.textengine.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.xml.XmpSerializer;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Builds small PDF documents in memory for adapter and service tests.
 */
public final class PdfFixtures {

    public static final float LEFT_X = 72f;
    public static final float RIGHT_X = 320f;

    private PdfFixtures() {
    }

    /**
     * Text drawn at a fixed position.
     */
    public record Placement(float x, float y, Standard14Fonts.FontName font, float size, String text) {

        public static Placement helvetica(float x, float y, String text) {
            return new Placement(x, y, Standard14Fonts.FontName.HELVETICA, 12f, text);
        }
    }

    /**
     * One page per entry, each holding the given placements in content-stream order.
     */
    @SafeVarargs
    public static byte[] pdf(List<Placement>... pages) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (List<Placement> placements : pages) {
                addPage(document, placements);
            }
            return save(document);
        }
    }

    /**
     * One page per text, each with a single Helvetica line at the top left.
     */
    public static byte[] pages(String... texts) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (String text : texts) {
                addPage(document, List.of(Placement.helvetica(LEFT_X, 700f, text)));
            }
            return save(document);
        }
    }

    /**
     * A page with two text columns whose lines are written interleaved, left then right.
     */
    public static byte[] twoColumnPage() throws IOException {
        return pdf(List.of(
                Placement.helvetica(LEFT_X, 700f, "Left one"),
                Placement.helvetica(RIGHT_X, 700f, "Right one"),
                Placement.helvetica(LEFT_X, 680f, "Left two"),
                Placement.helvetica(RIGHT_X, 680f, "Right two"),
                Placement.helvetica(LEFT_X, 660f, "Left three"),
                Placement.helvetica(RIGHT_X, 660f, "Right three")
        ));
    }

    public static byte[] withInfo(String title, String author) throws IOException {
        try (PDDocument document = new PDDocument()) {
            addPage(document, List.of(Placement.helvetica(LEFT_X, 700f, "Info")));
            PDDocumentInformation info = new PDDocumentInformation();
            info.setTitle(title);
            info.setAuthor(author);
            info.setProducer("text-engine tests");
            document.setDocumentInformation(info);
            return save(document);
        }
    }

    public static byte[] withXmpOnly(String title, String creator) throws IOException, TransformerException {
        try (PDDocument document = new PDDocument()) {
            addPage(document, List.of(Placement.helvetica(LEFT_X, 700f, "Xmp")));
            XMPMetadata xmp = XMPMetadata.createXMPMetadata();
            DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
            dc.setTitle(title);
            dc.addCreator(creator);
            ByteArrayOutputStream xmpBytes = new ByteArrayOutputStream();
            new XmpSerializer().serialize(xmp, xmpBytes, true);
            PDMetadata metadata = new PDMetadata(document);
            metadata.importXMPMetadata(xmpBytes.toByteArray());
            document.getDocumentCatalog().setMetadata(metadata);
            return save(document);
        }
    }

    /**
     * A document whose info dictionary names only the author and whose catalog carries the given XMP packet verbatim.
     */
    public static byte[] withRawXmp(String author, String xmpPacket) throws IOException {
        try (PDDocument document = new PDDocument()) {
            addPage(document, List.of(Placement.helvetica(LEFT_X, 700f, "Raw xmp")));
            PDDocumentInformation info = new PDDocumentInformation();
            info.setAuthor(author);
            document.setDocumentInformation(info);
            PDMetadata metadata = new PDMetadata(document);
            metadata.importXMPMetadata(xmpPacket.getBytes(StandardCharsets.UTF_8));
            document.getDocumentCatalog().setMetadata(metadata);
            return save(document);
        }
    }

    private static void addPage(PDDocument document, List<Placement> placements) throws IOException {
        PDPage page = new PDPage(PDRectangle.LETTER);
        document.addPage(page);
        try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
            for (Placement placement : placements) {
                contentStream.beginText();
                contentStream.setFont(new PDType1Font(placement.font()), placement.size());
                contentStream.newLineAtOffset(placement.x(), placement.y());
                contentStream.showText(placement.text());
                contentStream.endText();
            }
        }
    }

    private static byte[] save(PDDocument document) throws IOException {
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }
}
