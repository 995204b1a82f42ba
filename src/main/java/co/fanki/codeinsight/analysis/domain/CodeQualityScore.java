package co.fanki.codeinsight.analysis.domain;

/**
 * Heuristic 0-100 quality scores; higher is better.
 *
 * @param overall the rounded mean of the three partial scores
 * @param complexity the score derived from the average complexity
 * @param documentation the score derived from README, docs and
 *     function-bearing files
 * @param maintainability the score derived from file sizes and debt
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CodeQualityScore(
        int overall,
        int complexity,
        int documentation,
        int maintainability
) {
}
