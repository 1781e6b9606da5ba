package com.slicereport.core.report;

import com.slicereport.TestImages;
import com.slicereport.config.ReportSettings;
import com.slicereport.core.fs.SliceIndexResolver;
import com.slicereport.core.fs.SliceLayout;
import com.slicereport.core.image.ImageNormalizer;
import com.slicereport.core.image.NormalizedImage;
import com.slicereport.core.model.Axis;
import com.slicereport.core.model.Quantity;
import com.slicereport.core.plan.PagePlanner;
import com.slicereport.core.plan.PageTemplate;
import com.slicereport.core.plan.PlannedPage;
import com.slicereport.logging.ReportIssueLog;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportAssemblerTest {

    @TempDir
    Path tempDir;

    private SliceLayout layout;
    private ReportAssembler assembler;

    @BeforeEach
    void setUp() {
        layout = new SliceLayout(tempDir, ".bmp", "figures.pdf");
        assembler = new ReportAssembler(layout, ReportSettings.defaults().withWorkers(2),
            ReportIssueLog.inExportRoot(tempDir));
    }

    @Test
    void omitsPagesWithoutImagesAndKeepsTemplateNumbering() throws Exception {
        slice(Quantity.DISP, 100);
        slice(Quantity.MAX, 100);
        for (Quantity quantity : List.of(Quantity.DISP, Quantity.MAX, Quantity.MIN, Quantity.STATE)) {
            slice(quantity, 105);
        }
        Path output = layout.reportPath(Axis.X);

        AxisReport report = assembler.assemble(Axis.X, PageTemplate.DEFAULT, output);

        assertEquals(output.toAbsolutePath(), report.output());
        assertEquals(2, report.slices());
        assertEquals(3, report.pages());
        assertEquals(6, report.figures());
        assertEquals(2, report.skippedItems());
        assertEquals(0, report.oversizedImages());

        try (PDDocument pdf = PDDocument.load(output.toFile())) {
            assertEquals(3, pdf.getNumberOfPages());
            String first = pageText(pdf, 1);
            assertTrue(first.contains("X Slice @ 100"));
            assertTrue(first.contains("(1/2)"));
            assertTrue(first.contains("Displacement Magnitude"));
            assertTrue(first.contains("Slice 100"));
            assertFalse(first.contains("Zone State"));

            assertTrue(pageText(pdf, 2).contains("X Slice @ 105"));
            String third = pageText(pdf, 3);
            assertTrue(third.contains("(2/2)"));
            assertTrue(third.contains("Min Principal Effective Stress"));
            assertTrue(third.contains("Zone State"));
        }

        List<String> issues = Files.readAllLines(tempDir.resolve(ReportIssueLog.DEFAULT_FILENAME));
        assertEquals(3, issues.size());
        assertTrue(issues.get(1).contains(",x,100,"));
        assertTrue(issues.get(1).contains(",locate,"));
    }

    @Test
    void missingReferenceFolderAbortsWithoutOutput() {
        slice(Axis.Y, Quantity.MAX, 3);
        Path output = layout.reportPath(Axis.Y);

        AxisAbortedException ex = assertThrows(AxisAbortedException.class,
            () -> assembler.assemble(Axis.Y, PageTemplate.DEFAULT, output));

        assertEquals(Axis.Y, ex.getAxis());
        assertTrue(ex.getMessage().contains(layout.directory(Quantity.DISP, Axis.Y).toString()));
        assertFalse(Files.exists(output));
    }

    @Test
    void emptyFoldersAbort() throws IOException {
        Files.createDirectories(layout.directory(Quantity.DISP, Axis.Z));
        Files.writeString(layout.directory(Quantity.DISP, Axis.Z).resolve("notes.txt"), "no slices");
        Path output = layout.reportPath(Axis.Z);

        AxisAbortedException ex = assertThrows(AxisAbortedException.class,
            () -> assembler.assemble(Axis.Z, PageTemplate.DEFAULT, output));

        assertTrue(ex.getMessage().contains("No valid .bmp slice files found"));
        assertFalse(Files.exists(output));
    }

    @Test
    void undecodableImagesCountAsAbsent() throws Exception {
        slice(Quantity.DISP, 7);
        corrupt(Quantity.MIN, 7);
        corrupt(Quantity.STATE, 7);
        Path output = layout.reportPath(Axis.X);

        AxisReport report = assembler.assemble(Axis.X, PageTemplate.DEFAULT, output);

        assertEquals(1, report.pages());
        assertEquals(1, report.figures());
        assertEquals(3, report.skippedItems());
        try (PDDocument pdf = PDDocument.load(output.toFile())) {
            assertEquals(1, pdf.getNumberOfPages());
        }
        String issues = Files.readString(tempDir.resolve(ReportIssueLog.DEFAULT_FILENAME));
        assertTrue(issues.contains(",normalize,"));
    }

    @Test
    void oversizedImagesAreStillEmbeddedAndRecorded() throws Exception {
        ReportAssembler strict = new ReportAssembler(layout, new ReportSettings(100L, 10, 1, ".bmp", "figures.pdf"),
            ReportIssueLog.inExportRoot(tempDir));
        slice(Quantity.DISP, 12);
        Path output = layout.reportPath(Axis.X);

        AxisReport report = strict.assemble(Axis.X, PageTemplate.DEFAULT, output);

        assertEquals(1, report.figures());
        assertEquals(1, report.oversizedImages());
        try (PDDocument pdf = PDDocument.load(output.toFile())) {
            assertEquals(1, pdf.getNumberOfPages());
            String text = pageText(pdf, 1);
            assertTrue(text.contains("Displacement Magnitude"));
            assertTrue(text.contains("Slice 12"));
        }
        String issues = Files.readString(tempDir.resolve(ReportIssueLog.DEFAULT_FILENAME));
        assertTrue(issues.contains(",x,12,disp,normalize,"));
    }

    @Test
    void pageWithoutReadableWorkingCopiesIsOmitted() throws Exception {
        ImageNormalizer losesAllButDisplacement = new ImageNormalizer() {
            @Override
            public NormalizedImage normalize(Path source, Path target, long maxBytes, int minQuality) throws IOException {
                NormalizedImage image = super.normalize(source, target, maxBytes, minQuality);
                if (!source.getFileName().toString().contains("_disp_")) {
                    Files.delete(image.path());
                }
                return image;
            }
        };
        ReportAssembler assembler = new ReportAssembler(layout, ReportSettings.defaults().withWorkers(1),
            ReportIssueLog.inExportRoot(tempDir), new SliceIndexResolver(), new PagePlanner(), losesAllButDisplacement);
        for (Quantity quantity : List.of(Quantity.DISP, Quantity.MAX, Quantity.MIN, Quantity.STATE)) {
            slice(quantity, 40);
        }
        Path output = layout.reportPath(Axis.X);

        AxisReport report = assembler.assemble(Axis.X, PageTemplate.DEFAULT, output);

        assertEquals(1, report.pages());
        assertEquals(1, report.figures());
        assertEquals(3, report.skippedItems());
        try (PDDocument pdf = PDDocument.load(output.toFile())) {
            assertEquals(1, pdf.getNumberOfPages());
            String text = pageText(pdf, 1);
            assertTrue(text.contains("(1/2)"));
            assertFalse(text.contains("(2/2)"));
        }
        String issues = Files.readString(tempDir.resolve(ReportIssueLog.DEFAULT_FILENAME));
        assertTrue(issues.contains(",x,40,min,embed,"));
    }

    @Test
    void slicesOnlyPresentInOtherQuantitiesAreIncluded() throws Exception {
        slice(Quantity.DISP, 1);
        slice(Quantity.MIN, 2);
        Path output = layout.reportPath(Axis.X);

        AxisReport report = assembler.assemble(Axis.X, PageTemplate.DEFAULT, output);

        assertEquals(2, report.slices());
        assertEquals(2, report.pages());
        try (PDDocument pdf = PDDocument.load(output.toFile())) {
            String second = pageText(pdf, 2);
            assertTrue(second.contains("X Slice @ 2"));
            assertTrue(second.contains("(2/2)"));
        }
    }

    @Test
    void formatsHeadingAndCaption() {
        PlannedPage page = new PlannedPage(1, 2, List.of(Quantity.DISP));

        assertEquals("Z Slice @ 980  (1/2)", ReportAssembler.heading(Axis.Z, 980, page));
        assertEquals("ZZ Effective Stress – Slice 980", ReportAssembler.caption(Quantity.ZZ, 980));
    }

    private void slice(Quantity quantity, int index) {
        slice(Axis.X, quantity, index);
    }

    private void slice(Axis axis, Quantity quantity, int index) {
        try {
            TestImages.writeBmp(layout.sliceFile(quantity, axis, index), 120, 90, index * 31L + quantity.ordinal());
        } catch (IOException ex) {
            throw new IllegalStateException(ex);
        }
    }

    private void corrupt(Quantity quantity, int index) throws IOException {
        Path file = layout.sliceFile(quantity, Axis.X, index);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "not a bitmap");
    }

    private static String pageText(PDDocument pdf, int page) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        return stripper.getText(pdf);
    }
}
