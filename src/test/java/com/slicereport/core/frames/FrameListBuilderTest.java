package com.slicereport.core.frames;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FrameListBuilderTest {

    @TempDir
    Path tempDir;

    private final FrameListBuilder builder = new FrameListBuilder();

    @Test
    void ordersFolderNaturallyAndThins() throws IOException {
        for (String name : List.of("v_10.bmp", "v_2.bmp", "v_1.bmp", "v_3.BMP", "readme.txt")) {
            Files.writeString(tempDir.resolve(name), "");
        }

        assertEquals(List.of("v_1.bmp", "v_2.bmp", "v_3.BMP", "v_10.bmp"), names(builder.fromFolder(tempDir, ".bmp", 1)));
        assertEquals(List.of("v_1.bmp", "v_3.BMP"), names(builder.fromFolder(tempDir, ".bmp", 2)));
    }

    @Test
    void walksNumberedSubfoldersInOrder() throws IOException {
        for (String folder : List.of("10", "2", "1")) {
            Path dir = Files.createDirectories(tempDir.resolve(folder));
            Files.writeString(dir.resolve("f" + folder + "_a.bmp"), "");
            Files.writeString(dir.resolve("f" + folder + "_b.bmp"), "");
        }

        assertEquals(List.of("f1_a.bmp", "f2_a.bmp", "f10_a.bmp"), names(builder.fromSubfolders(tempDir, ".bmp", 2)));
    }

    @Test
    void failsWithoutImages() throws IOException {
        Files.writeString(tempDir.resolve("notes.txt"), "");

        assertThrows(IOException.class, () -> builder.fromFolder(tempDir, ".bmp", 1));
        assertThrows(IOException.class, () -> builder.fromFolder(tempDir.resolve("absent"), ".bmp", 1));
        assertThrows(IOException.class, () -> builder.fromSubfolders(tempDir, ".bmp", 1));
        assertThrows(IllegalArgumentException.class, () -> builder.fromFolder(tempDir, ".bmp", 0));
    }

    private static List<String> names(List<Path> frames) {
        return frames.stream().map(p -> p.getFileName().toString()).collect(Collectors.toList());
    }
}
