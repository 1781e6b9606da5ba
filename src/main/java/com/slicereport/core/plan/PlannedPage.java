package com.slicereport.core.plan;

import com.slicereport.core.model.Quantity;

import java.util.List;

/**
 * One page to emit for a slice index. Numbering is relative to the template, not to the emitted pages.
 */
public record PlannedPage(int pageNumber, int totalPages, List<Quantity> entries) {
    public PlannedPage {
        entries = List.copyOf(entries);
    }

    public String pageLabel() {
        return pageNumber + "/" + totalPages;
    }
}
