package com.slicereport.core.plan;

import com.slicereport.config.ReportConfigurationException;
import com.slicereport.core.model.Quantity;
import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered grouping of quantities; each group fills one report page for a slice index.
 * Validated on construction so a bad template fails before any file is touched.
 */
public final class PageTemplate {

    public static final PageTemplate DEFAULT = PageTemplate.of(
        List.of(Quantity.DISP, Quantity.MAX),
        List.of(Quantity.MIN, Quantity.STATE)
    );

    private final List<List<Quantity>> groups;

    private PageTemplate(List<List<Quantity>> groups) {
        this.groups = groups;
    }

    @SafeVarargs
    public static PageTemplate of(List<Quantity>... groups) {
        return of(List.of(groups));
    }

    public static PageTemplate of(List<List<Quantity>> groups) {
        if (groups == null || groups.isEmpty()) {
            throw new ReportConfigurationException("Page template needs at least one page group");
        }
        Set<Quantity> seen = EnumSet.noneOf(Quantity.class);
        List<List<Quantity>> copy = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            List<Quantity> group = groups.get(i);
            if (group == null || group.isEmpty()) {
                throw new ReportConfigurationException("Page group " + (i + 1) + " is empty");
            }
            for (Quantity quantity : group) {
                if (quantity == null) {
                    throw new ReportConfigurationException("Page group " + (i + 1) + " contains a null quantity");
                }
                if (!seen.add(quantity)) {
                    throw new ReportConfigurationException(
                        "Quantity '" + quantity.key() + "' appears more than once in the page template");
                }
            }
            copy.add(List.copyOf(group));
        }
        return new PageTemplate(Collections.unmodifiableList(copy));
    }

    /**
     * Parses a template such as {@code [["disp","max"],["min","state"]]}.
     */
    public static PageTemplate parse(String json) {
        try {
            JSONArray root = new JSONArray(json);
            List<List<Quantity>> groups = new ArrayList<>();
            for (int i = 0; i < root.length(); i++) {
                JSONArray groupArray = root.optJSONArray(i);
                if (groupArray == null) {
                    throw new ReportConfigurationException("Page group " + (i + 1) + " is not an array");
                }
                List<Quantity> group = new ArrayList<>();
                for (int j = 0; j < groupArray.length(); j++) {
                    group.add(Quantity.fromKey(groupArray.optString(j, null)));
                }
                groups.add(group);
            }
            return of(groups);
        } catch (JSONException ex) {
            throw new ReportConfigurationException("Malformed page template: " + ex.getMessage(), ex);
        }
    }

    public static PageTemplate load(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public List<List<Quantity>> groups() {
        return groups;
    }

    public int pageCount() {
        return groups.size();
    }

    /** The quantity whose directory must exist for an axis to be processed at all. */
    public Quantity referenceQuantity() {
        return groups.get(0).get(0);
    }

    public List<Quantity> quantities() {
        List<Quantity> all = new ArrayList<>();
        groups.forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        JSONArray root = new JSONArray();
        for (List<Quantity> group : groups) {
            JSONArray keys = new JSONArray();
            group.forEach(q -> keys.put(q.key()));
            root.put(keys);
        }
        return root.toString();
    }
}
