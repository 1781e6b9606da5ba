package com.slicereport.core.report;

import com.slicereport.config.ReportConfigurationException;
import com.slicereport.core.fs.SliceLayout;
import com.slicereport.core.model.Axis;
import com.slicereport.core.plan.PageTemplate;
import com.slicereport.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the report for several axes; a failed axis never stops the others.
 */
public final class MultiAxisReportRunner {

    private static final Logger LOGGER = AppLogger.get();

    private final SliceLayout layout;
    private final ReportAssembler assembler;

    public MultiAxisReportRunner(SliceLayout layout, ReportAssembler assembler) {
        this.layout = layout;
        this.assembler = assembler;
    }

    public List<AxisOutcome> run(List<Axis> axes, PageTemplate template) {
        List<AxisOutcome> outcomes = new ArrayList<>(axes.size());
        for (Axis axis : axes) {
            LOGGER.info("Generating " + axis.displayName() + " slice report...");
            try {
                AxisReport report = assembler.assemble(axis, template, layout.reportPath(axis));
                LOGGER.info("Report saved as: " + report.output()
                    + " (" + report.pages() + " pages, " + report.figures() + " figures, "
                    + report.skippedItems() + " skipped)");
                outcomes.add(AxisOutcome.generated(report));
            } catch (AxisAbortedException ex) {
                LOGGER.warning("Nothing generated for axis " + axis.displayName() + ": " + ex.getMessage());
                outcomes.add(AxisOutcome.skipped(axis, ex.getMessage()));
            } catch (ReportConfigurationException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                LOGGER.log(Level.SEVERE, "Nothing generated for axis " + axis.displayName() + ": " + ex.getMessage(), ex);
                outcomes.add(AxisOutcome.skipped(axis, String.valueOf(ex.getMessage())));
            }
        }
        return outcomes;
    }

    public record AxisOutcome(Axis axis, AxisReport report, String reason) {
        static AxisOutcome generated(AxisReport report) {
            return new AxisOutcome(report.axis(), report, null);
        }

        static AxisOutcome skipped(Axis axis, String reason) {
            return new AxisOutcome(axis, null, reason);
        }

        public boolean isGenerated() {
            return report != null;
        }
    }
}
