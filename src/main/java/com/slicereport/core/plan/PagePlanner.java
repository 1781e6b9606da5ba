package com.slicereport.core.plan;

import com.slicereport.core.model.Quantity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides which template pages to emit for one slice index.
 */
public final class PagePlanner {

    /**
     * Plans the pages for a slice.
     * <p>
     * A group with no present quantity is dropped entirely. A partially present group keeps only
     * the present quantities in template order. Page numbers always refer to the template's page
     * count, so "2/2" stays "2/2" even when page 1 was dropped for this slice.
     *
     * @param template      page layout
     * @param slicePresence whether each quantity has a file for the slice; missing keys count as absent
     * @return pages to emit, in template order
     */
    public List<PlannedPage> plan(PageTemplate template, Map<Quantity, Boolean> slicePresence) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(slicePresence, "slicePresence");

        int totalPages = template.pageCount();
        List<PlannedPage> pages = new ArrayList<>();
        int pageNumber = 0;
        for (List<Quantity> group : template.groups()) {
            pageNumber++;
            List<Quantity> present = new ArrayList<>(group.size());
            for (Quantity quantity : group) {
                if (Boolean.TRUE.equals(slicePresence.get(quantity))) {
                    present.add(quantity);
                }
            }
            if (!present.isEmpty()) {
                pages.add(new PlannedPage(pageNumber, totalPages, present));
            }
        }
        return pages;
    }
}
