package co.fanki.codeinsight.analysis.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rule-based extraction of structural facts from file content.
 *
 * <p>Pure: no I/O and no shared state. Function and export rules run
 * against the content with comments and string contents removed, so
 * commented-out or quoted declarations are not reported. Import rules
 * capture the specifier from inside the quotes and run with comments
 * removed only. Results are deduplicated keeping the first-seen order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PatternExtractor {

    private PatternExtractor() {
    }

    /**
     * Extracts function, import, export and TODO facts.
     *
     * @param content the file content, may be null
     * @param kind the language kind of the file
     * @return the extracted facts, never null
     */
    public static Extraction extract(final String content,
            final LanguageKind kind) {
        if (content == null || content.isEmpty()
                || kind == LanguageKind.UNKNOWN) {
            return new Extraction(List.of(), List.of(), List.of(), List.of());
        }
        final LanguageRules rules = kind.rules();
        final String code = SourceSanitizer.sanitize(content,
                rules.commentStyle());
        final String withStrings = SourceSanitizer.stripComments(content,
                rules.commentStyle());
        return new Extraction(
                apply(rules.functionRules(), code),
                apply(rules.importRules(), withStrings),
                apply(rules.exportRules(), code),
                TodoExtractor.extractTodos(content));
    }

    /**
     * Extracts the declared function names.
     *
     * @param content the file content
     * @param kind the language kind
     * @return the distinct names in first-seen order
     */
    public static List<String> extractFunctions(final String content,
            final LanguageKind kind) {
        return extract(content, kind).functions();
    }

    /**
     * Extracts the imported module specifiers.
     *
     * @param content the file content
     * @param kind the language kind
     * @return the distinct specifiers in first-seen order
     */
    public static List<String> extractImports(final String content,
            final LanguageKind kind) {
        return extract(content, kind).imports();
    }

    /**
     * Extracts the exported names.
     *
     * @param content the file content
     * @param kind the language kind
     * @return the distinct names in first-seen order
     */
    public static List<String> extractExports(final String content,
            final LanguageKind kind) {
        return extract(content, kind).exports();
    }

    private static List<String> apply(final List<ExtractionRule> rules,
            final String code) {
        final Set<String> names = new LinkedHashSet<>();
        for (final ExtractionRule rule : rules) {
            names.addAll(rule.extract(code));
        }
        return new ArrayList<>(names);
    }

    /**
     * Facts extracted from one file's content.
     *
     * @param functions declared function names
     * @param imports imported module specifiers
     * @param exports exported names
     * @param todos annotations, without file path
     */
    public record Extraction(
            List<String> functions,
            List<String> imports,
            List<String> exports,
            List<TodoComment> todos
    ) {
    }

}
