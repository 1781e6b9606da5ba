package com.slicereport.cli;

import com.slicereport.config.ConfigService;
import com.slicereport.config.ReportConfigurationException;
import com.slicereport.config.ReportSettings;
import com.slicereport.core.fs.SliceLayout;
import com.slicereport.core.model.Axis;
import com.slicereport.core.plan.PageTemplate;
import com.slicereport.core.report.MultiAxisReportRunner;
import com.slicereport.core.report.MultiAxisReportRunner.AxisOutcome;
import com.slicereport.core.report.ReportAssembler;
import com.slicereport.logging.AppLogger;
import com.slicereport.logging.ReportIssueLog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CLI that writes one figure report per axis.
 * <p>
 * Usage: {@code SliceReportTool [exportRoot] [x|y|z ...]}. Without axes all three are generated;
 * without a root {@code -DexportRoot}, the last used root or {@code ./exports} applies.
 */
public final class SliceReportTool {

    static final int EXIT_OK = 0;
    static final int EXIT_NOTHING_GENERATED = 1;
    static final int EXIT_CONFIGURATION = 2;

    private static final Logger LOGGER = AppLogger.get();

    private SliceReportTool() {}

    public static void main(String[] args) {
        int code;
        try {
            code = run(args, ConfigService.getInstance());
        } catch (ReportConfigurationException ex) {
            LOGGER.severe(ex.getMessage());
            code = EXIT_CONFIGURATION;
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Cannot read report configuration: " + ex.getMessage(), ex);
            code = EXIT_CONFIGURATION;
        }
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, ConfigService config) throws IOException {
        Arguments parsed = Arguments.parse(args);
        ReportSettings settings = config.loadSettings();
        PageTemplate template = config.loadPageTemplate();
        Path exportRoot = config.resolveExportRoot(parsed.exportRoot());

        LOGGER.info("Generating report...");
        LOGGER.info("Export root: " + exportRoot.toAbsolutePath() + ", template " + template);
        config.rememberExportRoot(exportRoot);

        SliceLayout layout = new SliceLayout(exportRoot, settings.extension(), settings.reportSuffix());
        ReportAssembler assembler = new ReportAssembler(layout, settings, ReportIssueLog.inExportRoot(exportRoot));
        List<AxisOutcome> outcomes = new MultiAxisReportRunner(layout, assembler).run(parsed.axes(), template);

        long generated = outcomes.stream().filter(AxisOutcome::isGenerated).count();
        LOGGER.info(generated + " of " + outcomes.size() + " axis reports generated");
        return generated > 0 ? EXIT_OK : EXIT_NOTHING_GENERATED;
    }

    record Arguments(String exportRoot, List<Axis> axes) {

        static Arguments parse(String[] args) {
            String root = null;
            Set<Axis> axes = new LinkedHashSet<>();
            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) continue;
                    String token = arg.trim();
                    if (Axis.isLetter(token)) {
                        axes.add(Axis.fromLetter(token));
                    } else if (root == null) {
                        root = token;
                    } else {
                        throw new ReportConfigurationException("Unexpected argument '" + token + "'");
                    }
                }
            }
            List<Axis> ordered = axes.isEmpty() ? List.of(Axis.values()) : new ArrayList<>(axes);
            return new Arguments(root, ordered);
        }
    }
}
