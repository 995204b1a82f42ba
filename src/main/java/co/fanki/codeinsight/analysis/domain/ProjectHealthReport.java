package co.fanki.codeinsight.analysis.domain;

/**
 * Derived reports computed on demand from a finished analysis.
 *
 * @param sizeDistribution files per size bucket
 * @param technicalDebtIndex the weighted annotation and overage score per
 *     file
 * @param qualityScore the heuristic quality scores
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectHealthReport(
        SizeDistribution sizeDistribution,
        double technicalDebtIndex,
        CodeQualityScore qualityScore
) {
}
