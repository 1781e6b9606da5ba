package com.slicereport.core.model;

import com.slicereport.config.ReportConfigurationException;

import java.util.Locale;

/**
 * Orthogonal slicing direction. Determines the slice folder and the filename prefix.
 */
public enum Axis {
    X("x"),
    Y("y"),
    Z("z");

    private final String letter;

    Axis(String letter) {
        this.letter = letter;
    }

    public String letter() {
        return letter;
    }

    public String displayName() {
        return letter.toUpperCase(Locale.ROOT);
    }

    /** Folder holding this axis' slices inside a quantity category, e.g. {@code xslice}. */
    public String sliceFolderName() {
        return letter + "slice";
    }

    /** True when {@code value} names an axis, ignoring case and surrounding blanks. */
    public static boolean isLetter(String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Axis axis : values()) {
            if (axis.letter.equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    public static Axis fromLetter(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Axis axis : values()) {
                if (axis.letter.equals(normalized)) {
                    return axis;
                }
            }
        }
        throw new ReportConfigurationException("Invalid axis '" + value + "'. Use 'x', 'y', or 'z'.");
    }
}
