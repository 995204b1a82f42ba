package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds import and export facts into directed edges.
 *
 * <p>Targets are kept as written; no resolution, deduplication across
 * files or cycle detection is performed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DependencyGraphBuilder {

    /**
     * Builds the edges, files first, imports before exports.
     *
     * @param files the per-file analyses
     * @return one edge per import and per export
     */
    public List<DependencyEdge> build(final List<FileAnalysis> files) {
        Preconditions.requireNonNull(files, "Files are required");
        final List<DependencyEdge> edges = new ArrayList<>();
        for (final FileAnalysis file : files) {
            for (final String imported : file.imports()) {
                edges.add(new DependencyEdge(file.path(), imported,
                        EdgeType.IMPORT));
            }
            for (final String exported : file.exports()) {
                edges.add(new DependencyEdge(file.path(), exported,
                        EdgeType.EXPORT));
            }
        }
        return edges;
    }

}
