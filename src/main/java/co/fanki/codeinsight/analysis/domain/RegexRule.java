package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction rule that reports one capture group of every match.
 *
 * @param pattern the compiled pattern
 * @param group the capture group holding the name
 * @param excluded names that are never reported, e.g. control keywords
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RegexRule(
        Pattern pattern,
        int group,
        Set<String> excluded
) implements ExtractionRule {

    /** Validates the rule. */
    public RegexRule {
        Preconditions.requireNonNull(pattern, "Pattern is required");
        Preconditions.requirePositive(group, "Group must be positive");
        excluded = excluded == null ? Set.of() : Set.copyOf(excluded);
    }

    /**
     * Creates a rule reporting group 1 of the given regular expression.
     *
     * @param regex the regular expression
     * @return the rule
     */
    public static RegexRule of(final String regex) {
        return new RegexRule(Pattern.compile(regex), 1, Set.of());
    }

    /**
     * Creates a rule reporting group 1 of the given multi-line regular
     * expression, skipping the given names.
     *
     * @param regex the regular expression, where {@code ^} matches at
     *     every line start
     * @param excluded the names to skip
     * @return the rule
     */
    public static RegexRule multiline(final String regex,
            final Set<String> excluded) {
        return new RegexRule(Pattern.compile(regex, Pattern.MULTILINE), 1,
                excluded);
    }

    /** {@inheritDoc} */
    @Override
    public List<String> extract(final String text) {
        final List<String> names = new ArrayList<>();
        final Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            final String name = matcher.group(group);
            if (name != null && !name.isBlank() && !excluded.contains(name)) {
                names.add(name.trim());
            }
        }
        return names;
    }

}
