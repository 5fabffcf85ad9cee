package org.persistor.test.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads what a file system blob store wrote below a root directory.
 */
public final class BlobFiles {

    private BlobFiles() {
    }

    public static List<Path> findBlobs(Path root) throws IOException {
        if (!Files.exists(root)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".txt"))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    /**
     * @return all non-empty lines of all blobs below {@code root}
     */
    public static List<String> readAllLines(Path root) throws IOException {
        List<String> lines = new ArrayList<>();
        for (Path blob : findBlobs(root)) {
            for (String line : Files.readAllLines(blob, StandardCharsets.UTF_8)) {
                if (!line.isEmpty()) {
                    lines.add(line);
                }
            }
        }
        return lines;
    }
}
