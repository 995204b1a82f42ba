package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;
import co.fanki.codeinsight.shared.ValueObject;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Structural facts extracted from one file.
 *
 * <p>Created once per file per run and immutable afterwards. The name
 * lists never contain duplicates; the compact constructor enforces it
 * while keeping first-seen order.</p>
 *
 * @param path the absolute file path
 * @param name the file name
 * @param type the lowercase extension, or "unknown"
 * @param size the size in bytes
 * @param linesOfCode the number of non-blank lines, 0 when not read
 * @param functions the declared function names
 * @param imports the imported module specifiers
 * @param exports the exported names
 * @param todos the annotations found in the file
 * @param complexity the complexity estimate, 0 when not computed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileAnalysis(
        String path,
        String name,
        String type,
        long size,
        int linesOfCode,
        List<String> functions,
        List<String> imports,
        List<String> exports,
        List<TodoComment> todos,
        int complexity
) implements ValueObject {

    /** Type reported for files without an extension. */
    public static final String UNKNOWN_TYPE = "unknown";

    /** Validates and copies. */
    public FileAnalysis {
        Preconditions.requireNonBlank(path, "File path is required");
        Preconditions.requireNonNull(name, "File name is required");
        type = type == null || type.isBlank() ? UNKNOWN_TYPE : type;
        Preconditions.requireNonNegative(size, "Size must not be negative");
        Preconditions.requireNonNegative(linesOfCode,
                "Lines of code must not be negative");
        functions = distinct(functions);
        imports = distinct(imports);
        exports = distinct(exports);
        todos = todos == null ? List.of() : List.copyOf(todos);
    }

    /**
     * Creates an analysis holding only the file system facts, for files
     * that are not read (unsupported extension or too large).
     *
     * @param path the absolute file path
     * @param name the file name
     * @param type the lowercase extension
     * @param size the size in bytes
     * @return the analysis with empty content facts
     */
    public static FileAnalysis unread(final String path, final String name,
            final String type, final long size) {
        return new FileAnalysis(path, name, type, size, 0, List.of(),
                List.of(), List.of(), List.of(), 0);
    }

    /**
     * Returns the file name without its last extension.
     *
     * @return the base name
     */
    public String baseName() {
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Checks whether the complexity estimate was computed.
     *
     * @return true if complexity is at least 1
     */
    public boolean hasComplexity() {
        return complexity >= 1;
    }

    private static List<String> distinct(final List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(values));
    }

}
