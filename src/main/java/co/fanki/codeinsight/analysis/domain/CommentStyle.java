package co.fanki.codeinsight.analysis.domain;

/**
 * Lexical family a language belongs to, as far as comments and string
 * literals are concerned.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum CommentStyle {

    /** {@code //} and {@code /* *\/} comments, quote and backtick strings. */
    C_STYLE,

    /** {@code #} comments, quote and triple-quote strings. */
    HASH

}
