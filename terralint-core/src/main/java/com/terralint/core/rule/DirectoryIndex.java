package com.terralint.core.rule;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Parameter;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.parser.ParsedFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cross-file view of one directory: where variables, outputs and locals are defined and
 * where variables are referenced.
 *
 * <p>Built once per directory after every file has been extracted, and read-only
 * afterwards. Files are indexed in path order, so the index does not depend on the order
 * in which files were discovered or processed. Definitions come only from files that
 * parsed cleanly; references are lexical and come from every file, heredoc bodies included.</p>
 */
public final class DirectoryIndex {

    private static final Pattern VARIABLE_REFERENCE = Pattern.compile("\\bvar\\.([A-Za-z_][\\w-]*)");

    private final List<Definition> variables;
    private final List<Definition> outputs;
    private final Map<String, Parameter> locals;
    private final List<Reference> references;

    private DirectoryIndex(List<Definition> variables, List<Definition> outputs,
                           Map<String, Parameter> locals, List<Reference> references) {
        this.variables = List.copyOf(variables);
        this.outputs = List.copyOf(outputs);
        this.locals = Map.copyOf(locals);
        this.references = List.copyOf(references);
    }

    /**
     * Indexes the parsed files of one directory.
     *
     * @param files parsed files of the directory, in any order
     * @return index
     */
    public static DirectoryIndex build(List<ParsedFile> files) {
        List<ParsedFile> ordered = files.stream()
            .sorted(Comparator.comparing(ParsedFile::path))
            .toList();

        List<Definition> variables = new ArrayList<>();
        List<Definition> outputs = new ArrayList<>();
        Map<String, Parameter> locals = new LinkedHashMap<>();
        List<Reference> references = new ArrayList<>();

        for (ParsedFile file : ordered) {
            if (!file.hasParseError()) {
                for (Block block : file.root().children()) {
                    if (block.kind() == BlockKind.VARIABLE && block.nameLabel().isPresent()) {
                        variables.add(new Definition(block.nameLabel().get(), file.path(), block));
                    } else if (block.kind() == BlockKind.OUTPUT && block.nameLabel().isPresent()) {
                        outputs.add(new Definition(block.nameLabel().get(), file.path(), block));
                    } else if (block.kind() == BlockKind.LOCALS) {
                        for (Parameter local : block.parameters()) {
                            locals.putIfAbsent(local.name(), local);
                        }
                    }
                }
            }
            collectReferences(file, references);
        }
        return new DirectoryIndex(variables, outputs, locals, references);
    }

    private static void collectReferences(ParsedFile file, List<Reference> references) {
        for (LineInfo line : file.lines()) {
            String text;
            if (line.isCode()) {
                text = line.code();
            } else if (line.isHeredoc()) {
                text = line.text();
            } else {
                continue;
            }
            Matcher matcher = VARIABLE_REFERENCE.matcher(text);
            while (matcher.find()) {
                String owner = enclosingVariable(file, line.number());
                references.add(new Reference(matcher.group(1), file.path(), line.number(), owner));
            }
        }
    }

    private static String enclosingVariable(ParsedFile file, int line) {
        for (Block block : file.root().children(BlockKind.VARIABLE)) {
            if (block.containsLine(line)) {
                return block.nameLabel().orElse(null);
            }
        }
        return null;
    }

    /**
     * Returns all variable definitions in file order, then source order.
     *
     * @return variable definitions
     */
    public List<Definition> variables() {
        return variables;
    }

    public List<Definition> outputs() {
        return outputs;
    }

    /**
     * Returns the first definition of a variable.
     *
     * @param name variable name
     * @return definition, or empty if the directory does not define it
     */
    public Optional<Definition> variable(String name) {
        return variables.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    /**
     * Returns a local value by name.
     *
     * @param name local name
     * @return the local's parameter
     */
    public Optional<Parameter> local(String name) {
        return Optional.ofNullable(locals.get(name));
    }

    public List<Reference> references() {
        return references;
    }

    /**
     * Returns the references to a variable, excluding those inside the variable's own block
     * (for example in its validation condition).
     *
     * @param name variable name
     * @return usage sites
     */
    public List<Reference> usages(String name) {
        return references.stream()
            .filter(r -> r.name().equals(name) && !name.equals(r.enclosingVariable()))
            .toList();
    }

    /**
     * Returns the references found in one file, in line order.
     *
     * @param file file path
     * @return references in that file
     */
    public List<Reference> referencesIn(Path file) {
        return references.stream().filter(r -> r.file().equals(file)).toList();
    }

    /**
     * A named top-level definition.
     *
     * @param name variable or output name
     * @param file defining file
     * @param block defining block
     */
    public record Definition(String name, Path file, Block block) {

        public int line() {
            return block.startLine();
        }

        public boolean hasDefault() {
            return block.hasParameter("default");
        }
    }

    /**
     * A {@code var.NAME} occurrence.
     *
     * @param name referenced variable
     * @param file file of the occurrence
     * @param line line of the occurrence
     * @param enclosingVariable name of the variable block containing the occurrence, or null
     */
    public record Reference(String name, Path file, int line, String enclosingVariable) {
    }
}
