package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;
import co.fanki.codeinsight.shared.ValueObject;

/**
 * One directed fact of the dependency graph.
 *
 * <p>{@code to} is the raw module specifier or exported name as written in
 * the source; it is not resolved to a file and may point outside the
 * project.</p>
 *
 * @param from the absolute path of the file the fact was read from
 * @param to the import specifier or exported name
 * @param type whether the fact is an import or an export
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DependencyEdge(
        String from,
        String to,
        EdgeType type
) implements ValueObject {

    /** Validates the edge. */
    public DependencyEdge {
        Preconditions.requireNonBlank(from, "Edge source is required");
        Preconditions.requireNonBlank(to, "Edge target is required");
        Preconditions.requireNonNull(type, "Edge type is required");
    }

}
