package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.analysis.domain.python.PythonRules;
import co.fanki.codeinsight.analysis.domain.script.ScriptRules;

import java.util.HashSet;
import java.util.Set;

/**
 * The language families the analyzer knows how to read.
 *
 * <p>Each kind carries its own ordered extraction rules, so dispatch by
 * file extension is a lookup rather than a chain of string checks.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum LanguageKind {

    /** JavaScript and TypeScript, plain or JSX. */
    SCRIPT(Set.of("js", "ts", "jsx", "tsx"), ScriptRules.rules()),

    /** Python. */
    PYTHON(Set.of("py"), PythonRules.rules()),

    /** Text formats with no functions or imports; TODOs are still read. */
    MARKUP(Set.of("html", "css", "json", "md", "txt"), LanguageRules.none()),

    /** Anything else. Never read. */
    UNKNOWN(Set.of(), LanguageRules.none());

    private final Set<String> extensions;

    private final LanguageRules rules;

    LanguageKind(final Set<String> theExtensions,
            final LanguageRules theRules) {
        this.extensions = theExtensions;
        this.rules = theRules;
    }

    /**
     * Resolves the kind of a file extension.
     *
     * @param extension the lowercase extension without dot, may be null
     * @return the matching kind, {@link #UNKNOWN} when not recognized
     */
    public static LanguageKind fromExtension(final String extension) {
        if (extension == null) {
            return UNKNOWN;
        }
        final String ext = extension.toLowerCase();
        for (final LanguageKind kind : values()) {
            if (kind.extensions.contains(ext)) {
                return kind;
            }
        }
        return UNKNOWN;
    }

    /**
     * Returns every extension the analyzer can read.
     *
     * @return the extensions of all kinds but {@link #UNKNOWN}
     */
    public static Set<String> textExtensions() {
        final Set<String> all = new HashSet<>();
        for (final LanguageKind kind : values()) {
            all.addAll(kind.extensions);
        }
        return all;
    }

    /**
     * Checks whether files of this kind are read at all.
     *
     * @return false only for {@link #UNKNOWN}
     */
    public boolean isText() {
        return this != UNKNOWN;
    }

    /**
     * Returns the extensions that map to this kind.
     *
     * @return the lowercase extensions
     */
    public Set<String> extensions() {
        return extensions;
    }

    /**
     * Returns the extraction rules of this kind.
     *
     * @return the rules
     */
    public LanguageRules rules() {
        return rules;
    }

}
