package com.slicereport.core.frames;

import com.slicereport.core.fs.NaturalOrderComparator;
import com.slicereport.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects exported images in playback order for the video encoder.
 */
public final class FrameListBuilder {

    private static final Logger LOGGER = AppLogger.get();
    private static final Comparator<Path> BY_NAME =
        Comparator.comparing(p -> p.getFileName().toString(), NaturalOrderComparator.INSTANCE);

    /**
     * Images of one folder in natural order, keeping every {@code skip}-th file.
     */
    public List<Path> fromFolder(Path folder, String extension, int skip) throws IOException {
        List<Path> frames = everyNth(listImages(folder, extension), skip);
        if (frames.isEmpty()) {
            throw new IOException("No " + extension + " files found in " + folder);
        }
        return frames;
    }

    /**
     * Images of every subfolder of {@code baseFolder}. Subfolders are visited in natural order
     * ({@code 01, 02, ... 10}) and thinned independently.
     */
    public List<Path> fromSubfolders(Path baseFolder, String extension, int skip) throws IOException {
        if (!Files.isDirectory(baseFolder)) {
            throw new IOException("Missing folder: " + baseFolder);
        }
        List<Path> subfolders;
        try (Stream<Path> stream = Files.list(baseFolder)) {
            subfolders = stream.filter(Files::isDirectory).sorted(BY_NAME).collect(Collectors.toList());
        }
        List<Path> frames = new ArrayList<>();
        for (Path subfolder : subfolders) {
            List<Path> images = everyNth(listImages(subfolder, extension), skip);
            LOGGER.fine(() -> subfolder.getFileName() + ": " + images.size() + " frames");
            frames.addAll(images);
        }
        if (frames.isEmpty()) {
            throw new IOException("No " + extension + " files found in subfolders of " + baseFolder);
        }
        return frames;
    }

    private static List<Path> listImages(Path folder, String extension) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new IOException("Missing folder: " + folder);
        }
        String extLower = extension.toLowerCase(Locale.ROOT);
        try (Stream<Path> stream = Files.list(folder)) {
            return stream.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extLower))
                .sorted(BY_NAME)
                .collect(Collectors.toList());
        }
    }

    private static List<Path> everyNth(List<Path> images, int skip) {
        if (skip < 1) {
            throw new IllegalArgumentException("skip must be at least 1: " + skip);
        }
        List<Path> kept = new ArrayList<>();
        for (int i = 0; i < images.size(); i += skip) {
            kept.add(images.get(i));
        }
        return kept;
    }
}
