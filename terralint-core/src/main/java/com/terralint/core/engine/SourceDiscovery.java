package com.terralint.core.engine;

import com.terralint.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds the Terraform files ({@code .tf} and {@code .tfvars}) below a lint root.
 *
 * <p><b>Filtering:</b></p>
 * <p>Hidden directories such as {@code .terraform} and {@code .git} are never entered. An
 * exclude entry without glob characters or {@code /} is a directory name and matches at any
 * depth; any other entry is a glob over the path relative to the root. When include globs are
 * given a file must match at least one of them.</p>
 *
 * <p>Files are returned sorted by path so traversal order, and therefore report order, is
 * stable across runs.</p>
 */
public class SourceDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SourceDiscovery.class);

    private final List<String> include;
    private final List<String> exclude;

    public SourceDiscovery() {
        this(List.of(), List.of());
    }

    /**
     * Creates a discovery with path filters.
     *
     * @param include globs a file must match, empty for all
     * @param exclude directory names or globs to skip
     */
    public SourceDiscovery(List<String> include, List<String> exclude) {
        this.include = List.copyOf(Objects.requireNonNull(include, "include must not be null"));
        this.exclude = List.copyOf(Objects.requireNonNull(exclude, "exclude must not be null"));
    }

    /**
     * Lists the Terraform files below a root.
     *
     * @param root directory to walk, or a single file
     * @return sorted file paths
     * @throws IOException if the tree cannot be walked
     */
    public List<Path> discover(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return isTerraformFile(root) ? List.of(root) : List.of();
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("Path does not exist: " + root);
        }

        List<String> excludedNames = new ArrayList<>();
        List<PathMatcher> excludedGlobs = new ArrayList<>();
        for (String entry : exclude) {
            if (isPlainName(entry)) {
                excludedNames.add(entry);
            } else {
                excludedGlobs.add(FileUtils.globMatcher(entry));
            }
        }
        List<PathMatcher> includedGlobs = include.stream().map(FileUtils::globMatcher).toList();

        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                Path relative = root.relativize(dir);
                if (FileUtils.isHidden(dir)
                    || excludedNames.contains(dir.getFileName().toString())
                    || matchesAny(excludedGlobs, relative)) {
                    log.debug("Skipping directory: {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                Path relative = root.relativize(file);
                if (attrs.isRegularFile()
                    && isTerraformFile(file)
                    && !matchesAny(excludedGlobs, relative)
                    && (includedGlobs.isEmpty() || matchesAny(includedGlobs, relative))) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(null);
        log.debug("Discovered {} Terraform files below {}", files.size(), root);
        return files;
    }

    private static boolean isTerraformFile(Path file) {
        return FileUtils.isConfigurationFile(file) || FileUtils.isVariableValuesFile(file);
    }

    private static boolean isPlainName(String entry) {
        return entry.chars().noneMatch(c -> c == '*' || c == '?' || c == '[' || c == '{' || c == '/');
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }
}
