package com.slicereport.cli;

import com.slicereport.core.frames.FrameListBuilder;
import com.slicereport.core.frames.FrameSequence;
import com.slicereport.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Writes the ordered frame list for a folder of exported slices, ready for the video encoder.
 * <p>
 * Usage: {@code FrameListTool <folder> [output]} with {@code -Dframes.fps} (default 5),
 * {@code -Dframes.extension} (default .bmp), {@code -Dframes.skip} (default 1) and
 * {@code -Dframes.subfolders=true} to walk numbered subfolders instead of one folder.
 */
public final class FrameListTool {

    private static final Logger LOGGER = AppLogger.get();

    private FrameListTool() {}

    public static void main(String[] args) throws IOException {
        if (args == null || args.length == 0 || args[0].isBlank()) {
            throw new IOException("No image folder given");
        }
        Path folder = Path.of(args[0].trim());
        Path output = args.length > 1 ? Path.of(args[1].trim()) : folder.resolve("frames.txt");
        run(folder, output,
            System.getProperty("frames.extension", ".bmp"),
            Integer.getInteger("frames.skip", 1),
            Double.parseDouble(System.getProperty("frames.fps", "5")),
            Boolean.getBoolean("frames.subfolders"));
    }

    static FrameSequence run(Path folder,
                             Path output,
                             String extension,
                             int skip,
                             double fps,
                             boolean subfolders) throws IOException {
        FrameListBuilder builder = new FrameListBuilder();
        List<Path> frames = subfolders
            ? builder.fromSubfolders(folder, extension, skip)
            : builder.fromFolder(folder, extension, skip);
        FrameSequence sequence = new FrameSequence(frames, fps);
        sequence.writeConcatList(output);
        LOGGER.info("Frame list with " + frames.size() + " images (skip=" + skip + ", fps=" + fps + ") saved as: "
            + output.toAbsolutePath());
        return sequence;
    }
}
