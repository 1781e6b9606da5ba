package com.slicereport.core.fs;

import com.slicereport.core.model.Axis;
import com.slicereport.core.model.Quantity;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Binds quantities and axes to the directory layout the slice producer writes:
 * {@code <root>/<category>/<axis>slice/<axis>_slice_<stem>_<index><ext>}.
 */
public record SliceLayout(Path exportRoot, String extension, String reportSuffix) {

    public SliceLayout {
        Objects.requireNonNull(exportRoot, "exportRoot");
        Objects.requireNonNull(extension, "extension");
        Objects.requireNonNull(reportSuffix, "reportSuffix");
    }

    public Path directory(Quantity quantity, Axis axis) {
        return exportRoot.resolve(quantity.categoryFolder()).resolve(axis.sliceFolderName());
    }

    public Path sliceFile(Quantity quantity, Axis axis, int sliceIndex) {
        return directory(quantity, axis).resolve(quantity.fileName(axis, sliceIndex, extension));
    }

    public Path reportPath(Axis axis) {
        return exportRoot.resolve(axis.sliceFolderName() + "_" + reportSuffix);
    }
}
