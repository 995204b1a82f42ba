package co.fanki.codeinsight.analysis.domain.script;

import co.fanki.codeinsight.analysis.domain.CommentStyle;
import co.fanki.codeinsight.analysis.domain.ComplexityEstimator;
import co.fanki.codeinsight.analysis.domain.ExportBlockRule;
import co.fanki.codeinsight.analysis.domain.LanguageRules;
import co.fanki.codeinsight.analysis.domain.RegexRule;

import java.util.List;
import java.util.Set;

/**
 * Extraction rules for JavaScript and TypeScript, including JSX/TSX.
 *
 * <p>Functions are {@code function name} declarations, arrow functions
 * assigned with {@code const}, {@code let} or {@code var}, and method-like
 * {@code name(} forms at the start of a line. Imports come from ES6
 * {@code import ... from} clauses and CommonJS {@code require} calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ScriptRules {

    /** Words that look like a method call at line start but are not. */
    private static final Set<String> KEYWORD_EXCLUSIONS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "require",
            "import", "function");

    private static final LanguageRules RULES = new LanguageRules(
            CommentStyle.C_STYLE,
            List.of(
                    RegexRule.of("function\\s+(\\w+)"),
                    RegexRule.of("(?:const|let|var)\\s+(\\w+)\\s*=.*?=>"),
                    RegexRule.multiline("^\\s*(\\w+)\\s*\\(",
                            KEYWORD_EXCLUSIONS)),
            List.of(
                    RegexRule.of(
                            "import.*?from\\s+['\"`]([^'\"`]+)['\"`]"),
                    RegexRule.of(
                            "require\\s*\\(\\s*['\"`]([^'\"`]+)['\"`]\\s*\\)")),
            List.of(
                    RegexRule.of("export\\s+(?:default\\s+)?"
                            + "(?:const|let|var|function|class)\\s+(\\w+)"),
                    new ExportBlockRule()),
            ComplexityEstimator.SCRIPT);

    private ScriptRules() {
    }

    /**
     * Returns the script language rules.
     *
     * @return the rules
     */
    public static LanguageRules rules() {
        return RULES;
    }

}
