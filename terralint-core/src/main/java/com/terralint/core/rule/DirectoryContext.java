package com.terralint.core.rule;

import com.terralint.core.parser.ParsedFile;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input of a {@link DirectoryRule}: every parsed file of one directory, their index and the
 * run's rule settings.
 *
 * @param directory directory path
 * @param files parsed files of the directory in traversal order
 * @param index cross-file index of the directory
 * @param settings rule settings
 */
public record DirectoryContext(
    Path directory,
    List<ParsedFile> files,
    DirectoryIndex index,
    RuleSettings settings
) {
    /**
     * Compact constructor with validation.
     */
    public DirectoryContext {
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Creates a context and builds its index.
     *
     * @param directory directory path
     * @param files parsed files of the directory
     * @param settings rule settings
     * @return context
     */
    public static DirectoryContext of(Path directory, List<ParsedFile> files, RuleSettings settings) {
        return new DirectoryContext(directory, files, DirectoryIndex.build(files), settings);
    }

    /**
     * Looks up a file of the directory by name.
     *
     * @param fileName file name such as {@code variables.tf}
     * @return parsed file, if present
     */
    public Optional<ParsedFile> file(String fileName) {
        return files.stream()
            .filter(f -> f.source().fileName().equals(fileName))
            .findFirst();
    }

    public Optional<ParsedFile> mainFile() {
        return file(settings.files().main());
    }

    public Optional<ParsedFile> variablesFile() {
        return file(settings.files().variables());
    }

    public Optional<ParsedFile> providersFile() {
        return file(settings.files().providers());
    }

    public Optional<ParsedFile> tfvarsFile() {
        return file(settings.files().tfvars());
    }
}
