package com.terralint.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Raw text of one configuration file split into lines.
 *
 * <p>Lines are stored without terminators. Content ending with a newline yields a final
 * empty line, so {@code "a\n"} becomes {@code ["a", ""]}.</p>
 *
 * @param path file path
 * @param lines raw lines, index 0 holds line 1
 */
public record SourceFile(
    Path path,
    List<String> lines
) {
    /**
     * Compact constructor with validation.
     */
    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * Splits file content into lines, normalising {@code \r\n} line endings.
     *
     * @param path file path
     * @param content full file content
     * @return source file
     */
    public static SourceFile of(Path path, String content) {
        String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
        return new SourceFile(path, List.of(normalized.split("\n", -1)));
    }

    /**
     * Returns a 1-based line.
     *
     * @param number line number starting at 1
     * @return line text
     */
    public String line(int number) {
        return lines.get(number - 1);
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Returns the directory containing this file.
     *
     * @return parent directory, or the path itself when it has no parent
     */
    public Path directory() {
        Path parent = path.getParent();
        return parent != null ? parent : path;
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
