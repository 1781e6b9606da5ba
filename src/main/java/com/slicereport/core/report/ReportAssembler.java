package com.slicereport.core.report;

import com.slicereport.config.ReportConfigurationException;
import com.slicereport.config.ReportSettings;
import com.slicereport.core.fs.SliceIndexResolver;
import com.slicereport.core.fs.SliceLayout;
import com.slicereport.core.image.ImageNormalizer;
import com.slicereport.core.image.NormalizedImage;
import com.slicereport.core.model.Axis;
import com.slicereport.core.model.Quantity;
import com.slicereport.core.pdf.SliceReportDocument;
import com.slicereport.core.plan.PagePlanner;
import com.slicereport.core.plan.PageTemplate;
import com.slicereport.core.plan.PlannedPage;
import com.slicereport.logging.AppLogger;
import com.slicereport.logging.ReportIssueLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Builds one paginated figure report per axis from the exported slice images.
 * <p>
 * Normalization of a slice's images runs on a worker pool; the document itself is only touched
 * from the calling thread, in plan order.
 */
public final class ReportAssembler {

    private static final Logger LOGGER = AppLogger.get();

    private final SliceLayout layout;
    private final ReportSettings settings;
    private final ReportIssueLog issues;
    private final SliceIndexResolver resolver;
    private final PagePlanner planner;
    private final ImageNormalizer normalizer;

    public ReportAssembler(SliceLayout layout, ReportSettings settings, ReportIssueLog issues) {
        this(layout, settings, issues, new SliceIndexResolver(), new PagePlanner(), new ImageNormalizer());
    }

    ReportAssembler(SliceLayout layout,
                    ReportSettings settings,
                    ReportIssueLog issues,
                    SliceIndexResolver resolver,
                    PagePlanner planner,
                    ImageNormalizer normalizer) {
        this.layout = layout;
        this.settings = settings;
        this.issues = issues;
        this.resolver = resolver;
        this.planner = planner;
        this.normalizer = normalizer;
    }

    /**
     * Generates the report for {@code axis} at {@code outputPath}.
     *
     * @throws AxisAbortedException when the reference folder is missing, no slice index exists,
     *                              nothing could be embedded or the document cannot be saved;
     *                              no file is left at {@code outputPath} in that case
     */
    public AxisReport assemble(Axis axis, PageTemplate template, Path outputPath) throws AxisAbortedException {
        if (axis == null) {
            throw new ReportConfigurationException("Axis is required");
        }
        if (template == null) {
            throw new ReportConfigurationException("Page template is required");
        }

        Quantity reference = template.referenceQuantity();
        Path referenceDir = layout.directory(reference, axis);
        if (!Files.isDirectory(referenceDir)) {
            throw new AxisAbortedException(axis, "Missing folder: " + referenceDir);
        }

        SortedSet<Integer> slices = resolveSlices(axis, template);
        LOGGER.info("Axis " + axis.displayName() + ": " + slices.size() + " slice indices "
            + slices.first() + ".." + slices.last());

        ExecutorService pool = Executors.newFixedThreadPool(settings.workers(), workerThreads());
        Path workDir = null;
        try (SliceReportDocument document = new SliceReportDocument()) {
            workDir = Files.createTempDirectory("slice-report-" + axis.letter() + "-");
            Tally tally = new Tally();
            for (int slice : slices) {
                processSlice(axis, template, slice, document, pool, workDir, tally);
                tally.slices++;
            }
            if (document.reportPageCount() == 0) {
                throw new AxisAbortedException(axis, "No slice image could be embedded");
            }
            Path saved;
            try {
                saved = document.save(outputPath);
            } catch (IOException ex) {
                throw new AxisAbortedException(axis, "Failed to save report " + outputPath + ": " + ex.getMessage(), ex);
            }
            return new AxisReport(axis, saved, tally.slices, document.reportPageCount(),
                tally.figures, tally.skipped, tally.oversized);
        } catch (IOException ex) {
            throw new AxisAbortedException(axis, "Document writer failed: " + ex.getMessage(), ex);
        } finally {
            pool.shutdownNow();
            deleteRecursively(workDir);
        }
    }

    private SortedSet<Integer> resolveSlices(Axis axis, PageTemplate template) throws AxisAbortedException {
        Map<Quantity, SortedSet<Integer>> perQuantity;
        try {
            perQuantity = resolver.resolveAll(layout, axis, template.quantities());
        } catch (IOException ex) {
            throw new AxisAbortedException(axis, "Cannot list slice folders: " + ex.getMessage(), ex);
        }
        for (Quantity disjoint : SliceIndexResolver.disjointQuantities(perQuantity)) {
            LOGGER.warning("Slices of " + disjoint.label() + " on axis " + axis.displayName()
                + " share no index with the other quantities " + perQuantity.get(disjoint)
                + "; check the producer's numbering");
        }
        SortedSet<Integer> slices = SliceIndexResolver.union(perQuantity.values());
        if (slices.isEmpty()) {
            throw new AxisAbortedException(axis, "No valid " + layout.extension() + " slice files found");
        }
        return slices;
    }

    private void processSlice(Axis axis,
                              PageTemplate template,
                              int slice,
                              SliceReportDocument document,
                              ExecutorService pool,
                              Path workDir,
                              Tally tally) throws IOException, AxisAbortedException {
        Map<Quantity, Boolean> presence = new EnumMap<>(Quantity.class);
        Map<Quantity, Future<NormalizedImage>> pending = new LinkedHashMap<>();
        for (Quantity quantity : template.quantities()) {
            Path source = layout.sliceFile(quantity, axis, slice);
            if (!Files.isRegularFile(source)) {
                presence.put(quantity, false);
                LOGGER.warning("Missing: " + source);
                issues.record(axis.letter(), slice, quantity.key(), "locate", source, "file not found");
                tally.skipped++;
                continue;
            }
            presence.put(quantity, true);
            Path target = ImageNormalizer.targetFor(source, workDir);
            pending.put(quantity, pool.submit(() ->
                normalizer.normalize(source, target, settings.maxImageBytes(), settings.minQuality())));
        }

        Map<Quantity, NormalizedImage> normalized = new EnumMap<>(Quantity.class);
        for (Map.Entry<Quantity, Future<NormalizedImage>> entry : pending.entrySet()) {
            Quantity quantity = entry.getKey();
            Path source = layout.sliceFile(quantity, axis, slice);
            try {
                NormalizedImage image = entry.getValue().get();
                if (!image.withinLimit()) {
                    tally.oversized++;
                    issues.record(axis.letter(), slice, quantity.key(), "normalize", source,
                        "above " + settings.maxImageBytes() + " bytes at quality " + image.quality());
                }
                normalized.put(quantity, image);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                presence.put(quantity, false);
                tally.skipped++;
                LOGGER.log(Level.WARNING, "Skipping " + source + ": " + cause.getMessage());
                issues.record(axis.letter(), slice, quantity.key(), "normalize", source, cause.getMessage());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new AxisAbortedException(axis, "Interrupted while normalizing slice " + slice, ex);
            }
        }

        List<PlannedPage> pages = planner.plan(template, presence);
        for (PlannedPage page : pages) {
            Map<Quantity, byte[]> figures = readFigures(axis, slice, page, normalized, tally);
            if (figures.isEmpty()) {
                LOGGER.warning("Omitting page " + page.pageLabel() + " of slice " + slice + ": no image could be read");
                continue;
            }
            document.startPage(heading(axis, slice, page));
            for (Map.Entry<Quantity, byte[]> figure : figures.entrySet()) {
                Quantity quantity = figure.getKey();
                try {
                    document.addFigure(figure.getValue(), caption(quantity, slice));
                    tally.figures++;
                } catch (IOException ex) {
                    tally.skipped++;
                    Path source = normalized.get(quantity).path();
                    LOGGER.log(Level.WARNING, "Could not embed " + source + ": " + ex.getMessage());
                    issues.record(axis.letter(), slice, quantity.key(), "embed", source, ex.getMessage());
                }
            }
            document.pageBreak();
        }
    }

    private Map<Quantity, byte[]> readFigures(Axis axis,
                                              int slice,
                                              PlannedPage page,
                                              Map<Quantity, NormalizedImage> normalized,
                                              Tally tally) throws IOException {
        Map<Quantity, byte[]> figures = new LinkedHashMap<>();
        for (Quantity quantity : page.entries()) {
            NormalizedImage image = normalized.get(quantity);
            try {
                figures.put(quantity, Files.readAllBytes(image.path()));
            } catch (IOException ex) {
                tally.skipped++;
                LOGGER.log(Level.WARNING, "Could not read " + image.path() + ": " + ex.getMessage());
                issues.record(axis.letter(), slice, quantity.key(), "embed", image.path(), ex.getMessage());
            } finally {
                Files.deleteIfExists(image.path());
            }
        }
        return figures;
    }

    static String heading(Axis axis, int slice, PlannedPage page) {
        return axis.displayName() + " Slice @ " + slice + "  (" + page.pageLabel() + ")";
    }

    static String caption(Quantity quantity, int slice) {
        return quantity.label() + " – Slice " + slice;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "NormalizePool-Worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException ex) {
                    LOGGER.fine("Could not delete working file " + p + ": " + ex.getMessage());
                }
            });
        } catch (IOException ex) {
            LOGGER.fine("Could not clean working folder " + dir + ": " + ex.getMessage());
        }
    }

    private static final class Tally {
        int slices;
        int figures;
        int skipped;
        int oversized;
    }
}
