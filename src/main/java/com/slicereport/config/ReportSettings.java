package com.slicereport.config;

/**
 * Tunables of one report run.
 *
 * @param maxImageBytes byte ceiling for every embedded image
 * @param minQuality    lowest JPEG quality (1-95) the normalizer may try
 * @param workers       size of the normalization worker pool
 * @param extension     raster extension the slice producer writes, including the dot
 * @param reportSuffix  suffix of the per-axis output file, {@code xslice_<suffix>}
 */
public record ReportSettings(long maxImageBytes,
                             int minQuality,
                             int workers,
                             String extension,
                             String reportSuffix) {

    public static final long DEFAULT_MAX_IMAGE_BYTES = 512_000L;
    public static final int DEFAULT_MIN_QUALITY = 10;
    public static final String DEFAULT_EXTENSION = ".bmp";
    public static final String DEFAULT_REPORT_SUFFIX = "figures.pdf";

    public ReportSettings {
        if (maxImageBytes <= 0) {
            throw new ReportConfigurationException("Image byte ceiling must be positive: " + maxImageBytes);
        }
        if (minQuality < 1 || minQuality > 95) {
            throw new ReportConfigurationException("Minimum quality must be within 1-95: " + minQuality);
        }
        if (workers < 1) {
            throw new ReportConfigurationException("Worker count must be at least 1: " + workers);
        }
        if (extension == null || extension.isBlank()) {
            throw new ReportConfigurationException("Raster extension is required");
        }
        if (reportSuffix == null || reportSuffix.isBlank()) {
            throw new ReportConfigurationException("Report suffix is required");
        }
        extension = extension.startsWith(".") ? extension : "." + extension;
    }

    public static ReportSettings defaults() {
        return new ReportSettings(
            DEFAULT_MAX_IMAGE_BYTES,
            DEFAULT_MIN_QUALITY,
            Runtime.getRuntime().availableProcessors(),
            DEFAULT_EXTENSION,
            DEFAULT_REPORT_SUFFIX
        );
    }

    public ReportSettings withWorkers(int count) {
        return new ReportSettings(maxImageBytes, minQuality, count, extension, reportSuffix);
    }
}
