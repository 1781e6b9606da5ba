package com.slicereport.core.frames;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Ordered frames and a frame rate, the input an external video encoder turns into a container.
 */
public record FrameSequence(List<Path> frames, double fps) {

    public FrameSequence {
        frames = List.copyOf(frames);
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be positive: " + fps);
        }
    }

    /**
     * Writes an ffmpeg concat list ({@code ffmpeg -f concat -safe 0 -i list.txt out.mp4}).
     */
    public Path writeConcatList(Path target) throws IOException {
        String duration = String.format(Locale.ROOT, "%.6f", 1.0 / fps);
        if (target.toAbsolutePath().getParent() != null) {
            Files.createDirectories(target.toAbsolutePath().getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write("ffconcat version 1.0");
            writer.newLine();
            for (Path frame : frames) {
                writer.write(fileLine(frame));
                writer.newLine();
                writer.write("duration " + duration);
                writer.newLine();
            }
            if (!frames.isEmpty()) {
                // the demuxer ignores the duration of the last entry
                writer.write(fileLine(frames.get(frames.size() - 1)));
                writer.newLine();
            }
        }
        return target;
    }

    private static String fileLine(Path frame) {
        String path = frame.toAbsolutePath().toString().replace("'", "'\\''");
        return "file '" + path + "'";
    }
}
