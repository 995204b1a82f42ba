package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects {@link ArchitecturePattern}s from file paths, names and
 * import/export facts.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ArchitectureDetector {

    /**
     * Detects patterns using absolute paths.
     *
     * @param files the per-file analyses
     * @return the display names of the detected patterns
     */
    public List<String> detectPatterns(final List<FileAnalysis> files) {
        return detectPatterns(null, files);
    }

    /**
     * Detects patterns using paths relative to the project root, so the
     * checkout location does not influence the result.
     *
     * @param projectRoot the absolute project root, or null
     * @param files the per-file analyses
     * @return the display names of the detected patterns, in declaration
     *     order of {@link ArchitecturePattern}
     */
    public List<String> detectPatterns(final String projectRoot,
            final List<FileAnalysis> files) {
        Preconditions.requireNonNull(files, "Files are required");

        final List<String> paths = new ArrayList<>(files.size());
        final List<String> names = new ArrayList<>(files.size());
        for (final FileAnalysis file : files) {
            paths.add(relativize(projectRoot, file.path()).toLowerCase());
            names.add(file.name().toLowerCase());
        }
        final ArchitecturePattern.Indicators indicators =
                new ArchitecturePattern.Indicators(paths, names, files);

        final List<String> detected = new ArrayList<>();
        for (final ArchitecturePattern pattern
                : ArchitecturePattern.values()) {
            if (pattern.matches(indicators)) {
                detected.add(pattern.displayName());
            }
        }
        return detected;
    }

    private static String relativize(final String root, final String path) {
        final String unixPath = path.replace('\\', '/');
        if (root == null) {
            return unixPath;
        }
        final String unixRoot = root.replace('\\', '/');
        return unixPath.startsWith(unixRoot + "/")
                ? unixPath.substring(unixRoot.length() + 1) : unixPath;
    }

}
