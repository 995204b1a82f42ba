package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;
import co.fanki.codeinsight.shared.ValueObject;

import java.util.List;

/**
 * Caller-supplied settings for one analysis run.
 *
 * <p>Read-only for the duration of a run. Replacing the configuration
 * between runs changes the cache key instead of mutating a running
 * analysis; use the {@code with*} methods to derive a new instance.</p>
 *
 * @param includeTests whether test files and test directories are analyzed
 * @param analysisDepth how much is extracted from each file
 * @param languages extension allow-list for discovery; empty allows every
 *     built-in source extension
 * @param ignorePatterns extra glob patterns, matched against paths relative
 *     to the project root
 * @param maxFileSize files larger than this many bytes are not read
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisConfig(
        boolean includeTests,
        AnalysisDepth analysisDepth,
        List<String> languages,
        List<String> ignorePatterns,
        long maxFileSize
) implements ValueObject {

    /** Default upper bound for files that are read: 1 MiB. */
    public static final long DEFAULT_MAX_FILE_SIZE = 1024L * 1024L;

    /** Extensions discovered when the caller gives no allow-list. */
    public static final List<String> DEFAULT_LANGUAGES = List.of(
            "js", "ts", "jsx", "tsx", "py", "html", "css", "json");

    /** Validates and copies the collections. */
    public AnalysisConfig {
        Preconditions.requireNonNull(analysisDepth,
                "Analysis depth is required");
        Preconditions.requireNonNegative(maxFileSize,
                "Max file size must not be negative");
        languages = languages == null ? List.of() : languages.stream()
                .map(AnalysisConfig::normalizeExtension)
                .filter(ext -> !ext.isEmpty())
                .distinct()
                .toList();
        ignorePatterns = ignorePatterns == null
                ? List.of() : List.copyOf(ignorePatterns);
    }

    /**
     * Returns the default configuration: no tests, medium depth, the
     * built-in languages, no extra ignores and a 1 MiB size limit.
     *
     * @return the default configuration
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(false, AnalysisDepth.MEDIUM,
                DEFAULT_LANGUAGES, List.of(), DEFAULT_MAX_FILE_SIZE);
    }

    /**
     * Returns a copy with the given test inclusion flag.
     *
     * @param include whether to include tests
     * @return the new configuration
     */
    public AnalysisConfig withIncludeTests(final boolean include) {
        return new AnalysisConfig(include, analysisDepth, languages,
                ignorePatterns, maxFileSize);
    }

    /**
     * Returns a copy with the given depth.
     *
     * @param depth the analysis depth
     * @return the new configuration
     */
    public AnalysisConfig withDepth(final AnalysisDepth depth) {
        return new AnalysisConfig(includeTests, depth, languages,
                ignorePatterns, maxFileSize);
    }

    /**
     * Returns a copy with the given extension allow-list.
     *
     * @param theLanguages the extensions, with or without leading dot
     * @return the new configuration
     */
    public AnalysisConfig withLanguages(final List<String> theLanguages) {
        return new AnalysisConfig(includeTests, analysisDepth, theLanguages,
                ignorePatterns, maxFileSize);
    }

    /**
     * Returns a copy with the given ignore globs.
     *
     * @param patterns the glob patterns
     * @return the new configuration
     */
    public AnalysisConfig withIgnorePatterns(final List<String> patterns) {
        return new AnalysisConfig(includeTests, analysisDepth, languages,
                patterns, maxFileSize);
    }

    /**
     * Returns a copy with the given size limit.
     *
     * @param bytes the maximum size of a file that is read
     * @return the new configuration
     */
    public AnalysisConfig withMaxFileSize(final long bytes) {
        return new AnalysisConfig(includeTests, analysisDepth, languages,
                ignorePatterns, bytes);
    }

    private static String normalizeExtension(final String value) {
        if (value == null) {
            return "";
        }
        final String trimmed = value.trim().toLowerCase();
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }

}
