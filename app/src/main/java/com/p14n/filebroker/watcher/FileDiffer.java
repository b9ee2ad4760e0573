package com.p14n.filebroker.watcher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

/**
 * Remembers the last seen content of each file and produces a unified line
 * diff against it when the file changes.
 */
public class FileDiffer {

    private static final Logger logger = LoggerFactory.getLogger(FileDiffer.class);

    static final String PREVIOUS = "previous";
    static final String CURRENT = "current";
    static final int CONTEXT_LINES = 3;

    private final Map<Path, List<String>> versions = new ConcurrentHashMap<>();

    /**
     * Records the current content of every readable file below the directory,
     * so that the first change to an existing file yields a real diff.
     */
    public void rememberAll(Path directory) throws IOException {
        try (Stream<Path> files = Files.walk(directory)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                try {
                    versions.put(file, read(file));
                } catch (IOException e) {
                    logger.atDebug().log("Not tracking {}: {}", file, e.getMessage());
                }
            });
        }
        logger.atDebug().log("Tracking {} file(s) below {}", versions.size(), directory);
    }

    /**
     * Reads the file, diffs it against the remembered version and remembers
     * the new content.
     *
     * @throws IOException if the file cannot be read as UTF-8 text
     */
    public String diff(Path file) throws IOException {
        List<String> current = read(file);
        List<String> previous = versions.put(file, current);
        return diff(previous, current);
    }

    public void forget(Path file) {
        versions.remove(file);
    }

    public boolean isTracked(Path file) {
        return versions.containsKey(file);
    }

    /**
     * Unified diff with {@code previous}/{@code current} headers. Without a
     * previous version every line is reported as added. Identical content
     * gives an empty string.
     */
    static String diff(List<String> previous, List<String> current) {
        if (previous == null) {
            return current.stream().map(line -> "+" + line).collect(Collectors.joining("\n"));
        }
        Patch<String> patch = DiffUtils.diff(previous, current);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(PREVIOUS, CURRENT, previous, patch,
                CONTEXT_LINES);
        return String.join("\n", unified);
    }

    private static List<String> read(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }
}
