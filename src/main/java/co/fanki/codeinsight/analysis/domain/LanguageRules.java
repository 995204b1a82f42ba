package co.fanki.codeinsight.analysis.domain;

import java.util.List;
import java.util.Optional;

/**
 * Ordered extraction rules and lexical settings of one language kind.
 *
 * @param commentStyle how comments and strings are written
 * @param functionRules rules for declared function names
 * @param importRules rules for imported module specifiers
 * @param exportRules rules for exported names
 * @param complexityEstimator the estimator, or null when the language
 *     carries no complexity estimate
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LanguageRules(
        CommentStyle commentStyle,
        List<ExtractionRule> functionRules,
        List<ExtractionRule> importRules,
        List<ExtractionRule> exportRules,
        ComplexityEstimator complexityEstimator
) {

    /** Copies the rule lists. */
    public LanguageRules {
        functionRules = functionRules == null
                ? List.of() : List.copyOf(functionRules);
        importRules = importRules == null
                ? List.of() : List.copyOf(importRules);
        exportRules = exportRules == null
                ? List.of() : List.copyOf(exportRules);
    }

    /**
     * Returns the rules of a language that has no structure to extract.
     *
     * @return rules with empty lists and no estimator
     */
    public static LanguageRules none() {
        return new LanguageRules(CommentStyle.C_STYLE, List.of(), List.of(),
                List.of(), null);
    }

    /**
     * Returns the complexity estimator, if this language has one.
     *
     * @return the estimator
     */
    public Optional<ComplexityEstimator> complexity() {
        return Optional.ofNullable(complexityEstimator);
    }

}
