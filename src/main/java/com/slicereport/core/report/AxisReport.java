package com.slicereport.core.report;

import com.slicereport.core.model.Axis;

import java.nio.file.Path;

/**
 * Summary of a written axis report.
 *
 * @param axis            axis the report covers
 * @param output          absolute path of the saved document
 * @param slices          slice indices processed
 * @param pages           report pages written
 * @param figures         images embedded
 * @param skippedItems    images skipped because they were missing or could not be decoded
 * @param oversizedImages images embedded above the byte ceiling
 */
public record AxisReport(Axis axis,
                         Path output,
                         int slices,
                         int pages,
                         int figures,
                         int skippedItems,
                         int oversizedImages) {
}
