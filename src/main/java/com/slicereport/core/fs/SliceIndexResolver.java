package com.slicereport.core.fs;

import com.slicereport.core.model.Axis;
import com.slicereport.core.model.Quantity;
import com.slicereport.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Discovers which slice indices exist by reading the numbers embedded in exported file names.
 */
public final class SliceIndexResolver {

    private static final Logger LOGGER = AppLogger.get();
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");

    /**
     * Lists {@code directory} (non-recursive) and returns the slice indices of files ending with
     * {@code expectedSuffix}, compared case-insensitively. A missing directory yields an empty set.
     */
    public SortedSet<Integer> resolve(Path directory, String expectedSuffix) throws IOException {
        SortedSet<Integer> indices = new TreeSet<>();
        if (directory == null || !Files.isDirectory(directory)) {
            LOGGER.fine(() -> "Missing folder: " + directory);
            return indices;
        }
        String suffixLower = expectedSuffix.toLowerCase(Locale.ROOT);
        try (Stream<Path> stream = Files.list(directory)) {
            stream.filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .filter(name -> name.toLowerCase(Locale.ROOT).endsWith(suffixLower))
                .forEach(name -> {
                    OptionalInt index = extractSliceIndex(name);
                    if (index.isPresent()) {
                        indices.add(index.getAsInt());
                    } else {
                        LOGGER.fine(() -> "Skipping file without slice number: " + name);
                    }
                });
        }
        return indices;
    }

    /**
     * Resolves every quantity's slice folder for an axis. Quantities are scanned in the given order.
     */
    public Map<Quantity, SortedSet<Integer>> resolveAll(SliceLayout layout,
                                                        Axis axis,
                                                        Collection<Quantity> quantities) throws IOException {
        Map<Quantity, SortedSet<Integer>> result = new EnumMap<>(Quantity.class);
        for (Quantity quantity : quantities) {
            Path directory = layout.directory(quantity, axis);
            SortedSet<Integer> indices = resolve(directory, layout.extension());
            if (indices.isEmpty()) {
                LOGGER.warning("No " + layout.extension() + " slices for " + quantity.label() + " in " + directory);
            }
            result.put(quantity, Collections.unmodifiableSortedSet(indices));
        }
        return result;
    }

    /**
     * First maximal run of decimal digits anywhere in the name, e.g. {@code 105} for
     * {@code x_slice_disp_105.bmp}.
     */
    public static OptionalInt extractSliceIndex(String fileName) {
        if (fileName == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = DIGIT_RUN.matcher(fileName);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group()));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    public static SortedSet<Integer> union(Collection<? extends Collection<Integer>> sets) {
        SortedSet<Integer> union = new TreeSet<>();
        sets.forEach(union::addAll);
        return union;
    }

    /**
     * Quantities with slices that share no index with any other quantity. Usually a sign that
     * the producer numbered that quantity differently.
     */
    public static List<Quantity> disjointQuantities(Map<Quantity, ? extends Collection<Integer>> perQuantity) {
        if (perQuantity.size() < 2) {
            return List.of();
        }
        return perQuantity.entrySet().stream()
            .filter(e -> !e.getValue().isEmpty())
            .filter(e -> perQuantity.entrySet().stream()
                .filter(other -> other.getKey() != e.getKey())
                .noneMatch(other -> !Collections.disjoint(other.getValue(), e.getValue())))
            .filter(e -> perQuantity.entrySet().stream()
                .anyMatch(other -> other.getKey() != e.getKey() && !other.getValue().isEmpty()))
            .map(Map.Entry::getKey)
            .toList();
    }
}
