package co.fanki.codeinsight.analysis.domain.python;

import co.fanki.codeinsight.analysis.domain.CommentStyle;
import co.fanki.codeinsight.analysis.domain.ComplexityEstimator;
import co.fanki.codeinsight.analysis.domain.LanguageRules;
import co.fanki.codeinsight.analysis.domain.RegexRule;

import java.util.List;
import java.util.Set;

/**
 * Extraction rules for Python.
 *
 * <p>Python has no export statement, so only functions and imports are
 * reported.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonRules {

    private static final LanguageRules RULES = new LanguageRules(
            CommentStyle.HASH,
            List.of(RegexRule.of("def\\s+(\\w+)")),
            List.of(
                    RegexRule.of("from\\s+(\\S+)\\s+import"),
                    RegexRule.multiline("^import\\s+(\\S+)", Set.of())),
            List.of(),
            ComplexityEstimator.PYTHON);

    private PythonRules() {
    }

    /**
     * Returns the python language rules.
     *
     * @return the rules
     */
    public static LanguageRules rules() {
        return RULES;
    }

}
