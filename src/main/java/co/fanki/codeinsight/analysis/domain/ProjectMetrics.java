package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.ValueObject;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Project-level totals and averages computed by {@link MetricsCalculator}.
 *
 * @param totalFiles the number of analyzed files
 * @param totalLines the sum of non-blank lines
 * @param totalFunctions the sum of extracted function names
 * @param avgLinesPerFile totalLines / totalFiles rounded to two decimals,
 *     0 when there are no files
 * @param avgComplexity the mean complexity rounded to two decimals
 * @param languages the distinct file types, sorted
 * @param testCoverage the heuristic percentage of source files that have
 *     a matching test file
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectMetrics(
        int totalFiles,
        int totalLines,
        int totalFunctions,
        double avgLinesPerFile,
        double avgComplexity,
        SortedSet<String> languages,
        int testCoverage
) implements ValueObject {

    /** Copies the language set into an unmodifiable sorted set. */
    public ProjectMetrics {
        languages = Collections.unmodifiableSortedSet(
                languages == null ? new TreeSet<>() : new TreeSet<>(languages));
    }

    /**
     * Returns the metrics of an empty project.
     *
     * @return all-zero metrics
     */
    public static ProjectMetrics empty() {
        return new ProjectMetrics(0, 0, 0, 0, 0, new TreeSet<>(), 0);
    }

}
