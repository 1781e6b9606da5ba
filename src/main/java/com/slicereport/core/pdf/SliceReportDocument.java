package com.slicereport.core.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Page-oriented PDF writer for slice reports: headings, fixed-size figures with captions and
 * explicit page breaks. Built in memory and saved once.
 */
public final class SliceReportDocument implements Closeable {

    private static final float POINTS_PER_INCH = 72f;
    private static final float MARGIN = 0.7f * POINTS_PER_INCH;
    private static final float IMAGE_WIDTH = 5.5f * POINTS_PER_INCH;
    private static final float IMAGE_HEIGHT = 4.0f * POINTS_PER_INCH;
    private static final float HEADING_SIZE = 16f;
    private static final float HEADING_GAP = 12f;
    private static final float CAPTION_SIZE = 9f;
    private static final float CAPTION_LINE_HEIGHT = 11f;
    private static final float CAPTION_SPACE_AFTER = 6f;

    private final PDDocument document;
    private PDPageContentStream stream;
    private float y;
    private int reportPages;

    public SliceReportDocument() {
        this.document = new PDDocument();
    }

    /**
     * Opens a new report page and writes its heading.
     */
    public void startPage(String heading) throws IOException {
        if (stream != null) {
            pageBreak();
        }
        openPhysicalPage();
        reportPages++;
        y -= HEADING_SIZE;
        stream.setFont(PDType1Font.HELVETICA_BOLD, HEADING_SIZE);
        writeLine(heading, MARGIN, y);
        y -= HEADING_GAP;
    }

    /**
     * Embeds a JPEG at the fixed display size followed by its caption line. A figure that does
     * not fit below the previous one continues on a fresh sheet of the same report page.
     */
    public void addFigure(byte[] jpegBytes, String caption) throws IOException {
        if (stream == null) {
            throw new IllegalStateException("startPage must be called before adding figures");
        }
        float needed = IMAGE_HEIGHT + CAPTION_LINE_HEIGHT + CAPTION_SPACE_AFTER;
        if (y - needed < MARGIN) {
            stream.close();
            openPhysicalPage();
        }
        PDImageXObject image = JPEGFactory.createFromByteArray(document, jpegBytes);
        y -= IMAGE_HEIGHT;
        stream.drawImage(image, MARGIN, y, IMAGE_WIDTH, IMAGE_HEIGHT);
        y -= CAPTION_LINE_HEIGHT;
        stream.setFont(PDType1Font.HELVETICA, CAPTION_SIZE);
        writeLine(caption, MARGIN, y);
        y -= CAPTION_SPACE_AFTER;
    }

    /**
     * Ends the current report page; the next content starts on a new sheet.
     */
    public void pageBreak() throws IOException {
        if (stream != null) {
            stream.close();
            stream = null;
        }
    }

    /** Report pages started, not counting continuation sheets. */
    public int reportPageCount() {
        return reportPages;
    }

    public int sheetCount() {
        return document.getNumberOfPages();
    }

    /**
     * Writes the document next to {@code output} and moves it into place, so an interrupted
     * save never leaves a truncated report behind.
     *
     * @return absolute path of the saved report
     */
    public Path save(Path output) throws IOException {
        pageBreak();
        Path absolute = output.toAbsolutePath();
        if (absolute.getParent() != null) {
            Files.createDirectories(absolute.getParent());
        }
        Path partial = absolute.resolveSibling(absolute.getFileName() + ".part");
        try {
            document.save(partial.toFile());
            try {
                Files.move(partial, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(partial, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(partial);
        }
        return absolute;
    }

    @Override
    public void close() throws IOException {
        try {
            pageBreak();
        } finally {
            document.close();
        }
    }

    private void openPhysicalPage() throws IOException {
        PDPage page = new PDPage(PDRectangle.LETTER);
        document.addPage(page);
        stream = new PDPageContentStream(document, page);
        y = page.getMediaBox().getHeight() - MARGIN;
    }

    private void writeLine(String text, float x, float baseline) throws IOException {
        stream.beginText();
        stream.newLineAtOffset(x, baseline);
        stream.showText(text);
        stream.endText();
    }
}
