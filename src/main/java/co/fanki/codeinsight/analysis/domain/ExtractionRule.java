package co.fanki.codeinsight.analysis.domain;

import java.util.List;

/**
 * One text-matching rule that pulls names out of source text.
 *
 * <p>Rules are heuristics over text, not parsers: they may report names
 * that a compiler would reject and miss unusual syntax.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ExtractionRule {

    /**
     * Extracts the names this rule recognizes, in order of appearance.
     *
     * @param text the source text, never null
     * @return the names found, possibly with duplicates, never null
     */
    List<String> extract(String text);

}
