package com.terralint.core.rule;

import com.terralint.core.model.Block;
import com.terralint.core.model.SourceFile;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.util.FileUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Input of a {@link FileRule}: one parsed file plus the run's rule settings.
 *
 * @param file parsed file
 * @param settings rule settings
 */
public record FileContext(
    ParsedFile file,
    RuleSettings settings
) {
    /**
     * Compact constructor with validation.
     */
    public FileContext {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
    }

    public Path path() {
        return file.path();
    }

    public SourceFile source() {
        return file.source();
    }

    public Block root() {
        return file.root();
    }

    public List<LineInfo> lines() {
        return file.lines();
    }

    public LineInfo line(int number) {
        return file.line(number);
    }

    public String fileName() {
        return file.source().fileName();
    }

    /**
     * Returns true for {@code .tfvars} files, which hold only top-level assignments.
     *
     * @return true for variable value files
     */
    public boolean isVariableValuesFile() {
        return FileUtils.isVariableValuesFile(file.path());
    }
}
