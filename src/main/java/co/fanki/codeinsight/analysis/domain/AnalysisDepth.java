package co.fanki.codeinsight.analysis.domain;

/**
 * How much work the {@link FileAnalyzer} performs on each qualifying file.
 *
 * <p>Depths are cumulative: every level includes what the previous one
 * computes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum AnalysisDepth {

    /** Size and non-blank line count only. */
    BASIC,

    /** Adds functions, imports, exports and TODO comments. */
    MEDIUM,

    /** Adds the cyclomatic complexity estimate. */
    DEEP;

    /**
     * Parses a depth name, case-insensitively.
     *
     * @param value the depth name, may be null
     * @return the matching depth, or {@link #MEDIUM} when null, blank or
     *     not recognized
     */
    public static AnalysisDepth fromString(final String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (final IllegalArgumentException e) {
            return MEDIUM;
        }
    }

    /**
     * Checks whether functions, imports, exports and TODOs are extracted.
     *
     * @return true for MEDIUM and DEEP
     */
    public boolean extractsStructure() {
        return this != BASIC;
    }

    /**
     * Checks whether the complexity estimate is computed.
     *
     * @return true only for DEEP
     */
    public boolean estimatesComplexity() {
        return this == DEEP;
    }

}
