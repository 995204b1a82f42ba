package co.fanki.codeinsight.analysis.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the local names listed in {@code export { a, b as c }} blocks.
 *
 * <p>For {@code b as c} the local name {@code b} is reported.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExportBlockRule implements ExtractionRule {

    private static final Pattern EXPORT_BLOCK = Pattern.compile(
            "export\\s*\\{\\s*([^}]+)\\s*}");

    private static final Pattern ALIAS = Pattern.compile("\\s+as\\s+");

    /** {@inheritDoc} */
    @Override
    public List<String> extract(final String text) {
        final List<String> names = new ArrayList<>();
        final Matcher matcher = EXPORT_BLOCK.matcher(text);
        while (matcher.find()) {
            for (final String item : matcher.group(1).split(",")) {
                final String local = ALIAS.split(item.trim(), 2)[0].trim();
                if (!local.isEmpty()) {
                    names.add(local);
                }
            }
        }
        return names;
    }

}
