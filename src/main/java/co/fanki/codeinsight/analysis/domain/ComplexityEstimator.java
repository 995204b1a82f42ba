package co.fanki.codeinsight.analysis.domain;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximates cyclomatic complexity from source text.
 *
 * <p>The text is first run through the {@link SourceSanitizer} so that
 * decision keywords inside comments, string literals and template
 * literals are not counted. The result is {@code 1 + } the number of
 * decision points found; it is a heuristic, not a control-flow
 * analysis.</p>
 *
 * <p>Decision points for script languages: {@code if}, {@code else if}
 * (counted once), {@code while}, {@code for}, {@code switch},
 * {@code case}, {@code catch}, ternaries, {@code &&} and {@code ||}.
 * Optional chaining ({@code ?.}), nullish coalescing ({@code ??}) and
 * optional members ({@code x?:}) are not ternaries. Python counts
 * {@code if}, {@code elif}, {@code while}, {@code for}, {@code except},
 * {@code and} and {@code or}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ComplexityEstimator {

    /** Matches script branching keywords; else-if is one match. */
    private static final Pattern SCRIPT_KEYWORDS = Pattern.compile(
            "\\b(?:else\\s+if|if|while|for|switch|case|catch)\\b");

    /** One match per ternary {@code ?}, so nested ternaries count each. */
    private static final Pattern TERNARY = Pattern.compile(
            "(?<![?])\\?(?![.?:])(?=[^;]*:)");

    private static final Pattern LOGICAL_OPERATORS = Pattern.compile(
            "&&|\\|\\|");

    private static final Pattern PYTHON_KEYWORDS = Pattern.compile(
            "\\b(?:if|elif|while|for|except|and|or)\\b");

    /** Estimator for js, ts, jsx and tsx sources. */
    public static final ComplexityEstimator SCRIPT = new ComplexityEstimator(
            CommentStyle.C_STYLE,
            List.of(SCRIPT_KEYWORDS, TERNARY, LOGICAL_OPERATORS));

    /** Estimator for python sources. */
    public static final ComplexityEstimator PYTHON = new ComplexityEstimator(
            CommentStyle.HASH, List.of(PYTHON_KEYWORDS));

    private final CommentStyle commentStyle;

    private final List<Pattern> decisionPoints;

    private ComplexityEstimator(final CommentStyle theCommentStyle,
            final List<Pattern> theDecisionPoints) {
        this.commentStyle = theCommentStyle;
        this.decisionPoints = theDecisionPoints;
    }

    /**
     * Estimates the complexity of script source text.
     *
     * @param code the source text, may be null or empty
     * @return the estimate, always at least 1
     */
    public static int complexity(final String code) {
        return SCRIPT.estimate(code);
    }

    /**
     * Estimates the complexity of the given source text.
     *
     * @param code the source text, may be null or empty
     * @return the estimate, always at least 1
     */
    public int estimate(final String code) {
        final String clean = SourceSanitizer.sanitize(code, commentStyle);
        int count = 1;
        for (final Pattern pattern : decisionPoints) {
            count += countMatches(pattern, clean);
        }
        return count;
    }

    /**
     * Returns the comment style this estimator sanitizes with.
     *
     * @return the comment style
     */
    public CommentStyle commentStyle() {
        return commentStyle;
    }

    private static int countMatches(final Pattern pattern, final String text) {
        final Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

}
