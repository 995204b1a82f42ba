package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;
import co.fanki.codeinsight.shared.ValueObject;

/**
 * A TODO, FIXME, HACK or NOTE annotation found in a source file.
 *
 * <p>The copy attached to a {@link FileAnalysis} has no file path; the
 * copy flattened into {@link ProjectAnalysis#todos()} carries the path of
 * the file that owns it.</p>
 *
 * @param type the annotation kind
 * @param content the trimmed comment body
 * @param line the 1-based line number
 * @param filePath the owning file path, or null on the per-file copy
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TodoComment(
        TodoType type,
        String content,
        int line,
        String filePath
) implements ValueObject {

    /** Validates the annotation. */
    public TodoComment {
        Preconditions.requireNonNull(type, "Todo type is required");
        Preconditions.requireNonNull(content, "Todo content is required");
        Preconditions.requirePositive(line, "Line numbers are 1-based");
    }

    /**
     * Creates an annotation not yet attached to a file path.
     *
     * @param type the annotation kind
     * @param content the trimmed comment body
     * @param line the 1-based line number
     * @return the annotation
     */
    public static TodoComment of(final TodoType type, final String content,
            final int line) {
        return new TodoComment(type, content, line, null);
    }

    /**
     * Returns a copy of this annotation carrying the owning file path.
     *
     * @param path the owning file path
     * @return the located annotation
     */
    public TodoComment locatedIn(final String path) {
        return new TodoComment(type, content, line, path);
    }

}
