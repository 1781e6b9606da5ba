package com.slicereport.core.report;

import com.slicereport.TestImages;
import com.slicereport.config.ReportSettings;
import com.slicereport.core.fs.SliceLayout;
import com.slicereport.core.model.Axis;
import com.slicereport.core.model.Quantity;
import com.slicereport.core.plan.PageTemplate;
import com.slicereport.core.report.MultiAxisReportRunner.AxisOutcome;
import com.slicereport.logging.ReportIssueLog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MultiAxisReportRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void failedAxisDoesNotStopTheOthers() throws IOException {
        SliceLayout layout = new SliceLayout(tempDir, ".bmp", "figures.pdf");
        TestImages.writeBmp(layout.sliceFile(Quantity.DISP, Axis.X, 10), 64, 48, 1L);
        TestImages.writeBmp(layout.sliceFile(Quantity.STATE, Axis.Z, 4), 64, 48, 2L);
        TestImages.writeBmp(layout.sliceFile(Quantity.DISP, Axis.Z, 4), 64, 48, 3L);
        ReportAssembler assembler = new ReportAssembler(layout, ReportSettings.defaults().withWorkers(1),
            ReportIssueLog.disabled());

        List<AxisOutcome> outcomes = new MultiAxisReportRunner(layout, assembler)
            .run(List.of(Axis.X, Axis.Y, Axis.Z), PageTemplate.DEFAULT);

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).isGenerated());
        assertEquals(Axis.Y, outcomes.get(1).axis());
        assertFalse(outcomes.get(1).isGenerated());
        assertNull(outcomes.get(1).report());
        assertTrue(outcomes.get(1).reason().startsWith("Missing folder"));
        assertTrue(outcomes.get(2).isGenerated());
        assertEquals(2, outcomes.get(2).report().pages());

        assertTrue(Files.exists(tempDir.resolve("xslice_figures.pdf")));
        assertFalse(Files.exists(tempDir.resolve("yslice_figures.pdf")));
        assertTrue(Files.exists(tempDir.resolve("zslice_figures.pdf")));
    }
}
