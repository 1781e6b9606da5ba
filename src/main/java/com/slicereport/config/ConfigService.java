package com.slicereport.config;

import com.slicereport.core.plan.PageTemplate;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Central entry point for resolving configuration values with overrides and persisted preferences.
 * Explicit values win over system properties, which win over stored preferences and defaults.
 */
public final class ConfigService {
    static final String EXPORT_ROOT_PROPERTY = "exportRoot";
    static final String MAX_BYTES_PROPERTY = "report.maxBytes";
    static final String MIN_QUALITY_PROPERTY = "report.minQuality";
    static final String WORKERS_PROPERTY = "report.workers";
    static final String EXTENSION_PROPERTY = "report.extension";
    static final String SUFFIX_PROPERTY = "report.suffix";
    static final String TEMPLATE_PROPERTY = "report.template";
    static final String PREF_KEY_EXPORT_ROOT = "export.root";

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    public ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public Path resolveExportRoot(String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return Paths.get(explicit.trim());
        }
        String override = System.getProperty(EXPORT_ROOT_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override.trim());
        }
        Optional<Path> persisted = preferences.getPath(PREF_KEY_EXPORT_ROOT);
        return persisted.orElse(Paths.get(System.getProperty("user.dir"), "exports"));
    }

    public void rememberExportRoot(Path exportRoot) {
        if (exportRoot == null) return;
        preferences.putPath(PREF_KEY_EXPORT_ROOT, exportRoot.toAbsolutePath());
    }

    public ReportSettings loadSettings() {
        ReportSettings defaults = ReportSettings.defaults();
        return new ReportSettings(
            longProperty(MAX_BYTES_PROPERTY, defaults.maxImageBytes()),
            intProperty(MIN_QUALITY_PROPERTY, defaults.minQuality()),
            intProperty(WORKERS_PROPERTY, defaults.workers()),
            System.getProperty(EXTENSION_PROPERTY, defaults.extension()),
            System.getProperty(SUFFIX_PROPERTY, defaults.reportSuffix())
        );
    }

    public PageTemplate loadPageTemplate() throws IOException {
        String path = System.getProperty(TEMPLATE_PROPERTY);
        if (path == null || path.isBlank()) {
            return PageTemplate.DEFAULT;
        }
        return PageTemplate.load(Paths.get(path.trim()));
    }

    private static int intProperty(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new ReportConfigurationException("Property " + name + " is not an int: " + raw, ex);
        }
    }

    private static long longProperty(String name, long fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new ReportConfigurationException("Property " + name + " is not a number: " + raw, ex);
        }
    }
}
