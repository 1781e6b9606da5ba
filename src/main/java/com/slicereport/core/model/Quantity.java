package com.slicereport.core.model;

import com.slicereport.config.ReportConfigurationException;

import java.util.Locale;

/**
 * Physical field categories exported as one image per slice.
 */
public enum Quantity {
    DISP("disp", "Displacement Magnitude", "displacements", "disp"),
    MAX("max", "Max Principal Effective Stress", "max_principal", "max_principal"),
    MIN("min", "Min Principal Effective Stress", "min_principal", "min_principal"),
    STATE("state", "Zone State", "zone_state", "state"),
    ZZ("zz", "ZZ Effective Stress", "zz_stress", "zz");

    private final String key;
    private final String label;
    private final String categoryFolder;
    private final String fileStem;

    Quantity(String key, String label, String categoryFolder, String fileStem) {
        this.key = key;
        this.label = label;
        this.categoryFolder = categoryFolder;
        this.fileStem = fileStem;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public String categoryFolder() {
        return categoryFolder;
    }

    /**
     * Builds the file name the slice producer writes for this quantity,
     * e.g. {@code x_slice_max_principal_105.bmp}.
     */
    public String fileName(Axis axis, int sliceIndex, String extension) {
        return axis.letter() + "_slice_" + fileStem + "_" + sliceIndex + extension;
    }

    public static Quantity fromKey(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Quantity quantity : values()) {
                if (quantity.key.equals(normalized)) {
                    return quantity;
                }
            }
        }
        throw new ReportConfigurationException("Unknown quantity key '" + value + "'");
    }
}
