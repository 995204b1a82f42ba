package co.fanki.codeinsight.analysis.domain;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Single-pass scanner that blanks out comments and, optionally, string
 * literal contents.
 *
 * <p>A quote inside a comment or a comment marker inside a string cannot
 * derail the scan because both are recognized by the same state machine.
 * Newlines are always preserved so line numbers stay meaningful, and a
 * stripped literal keeps its delimiters (e.g. {@code "if"} becomes
 * {@code ""}).</p>
 *
 * <p>Template literals track nested {@code ${ }} interpolations with a
 * stack of brace depths; everything between the outer backticks,
 * interpolations included, counts as string content.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceSanitizer {

    private enum State {
        NORMAL,
        LINE_COMMENT,
        BLOCK_COMMENT,
        SINGLE,
        DOUBLE,
        TRIPLE_SINGLE,
        TRIPLE_DOUBLE,
        TEMPLATE,
        INTERPOLATION
    }

    private final String code;
    private final CommentStyle style;
    private final boolean keepStrings;
    private final StringBuilder out;

    /** Open brace count of every enclosing interpolation, innermost first. */
    private final Deque<Integer> interpolations = new ArrayDeque<>();

    private State state = State.NORMAL;
    private int pos;

    private SourceSanitizer(final String theCode, final CommentStyle theStyle,
            final boolean isKeepStrings) {
        this.code = theCode;
        this.style = theStyle;
        this.keepStrings = isKeepStrings;
        this.out = new StringBuilder(theCode.length());
    }

    /**
     * Removes comments and the contents of every string literal.
     *
     * @param code the source text, may be null
     * @param style the comment style of the language
     * @return the sanitized text, never null
     */
    public static String sanitize(final String code,
            final CommentStyle style) {
        return scan(code, style, false);
    }

    /**
     * Removes comments but keeps string literals intact.
     *
     * @param code the source text, may be null
     * @param style the comment style of the language
     * @return the text without comments, never null
     */
    public static String stripComments(final String code,
            final CommentStyle style) {
        return scan(code, style, true);
    }

    private static String scan(final String code, final CommentStyle style,
            final boolean keepStrings) {
        if (code == null || code.isEmpty()) {
            return "";
        }
        return new SourceSanitizer(code, style, keepStrings).run();
    }

    private String run() {
        while (pos < code.length()) {
            final char c = code.charAt(pos);
            switch (state) {
                case NORMAL -> normal(c);
                case LINE_COMMENT -> lineComment(c);
                case BLOCK_COMMENT -> blockComment(c);
                case SINGLE -> quoted(c, '\'');
                case DOUBLE -> quoted(c, '"');
                case TRIPLE_SINGLE -> tripleQuoted(c, '\'');
                case TRIPLE_DOUBLE -> tripleQuoted(c, '"');
                case TEMPLATE -> template(c);
                case INTERPOLATION -> interpolation(c);
                default -> throw new IllegalStateException(
                        "Unknown state " + state);
            }
        }
        return out.toString();
    }

    private void normal(final char c) {
        if (style == CommentStyle.HASH) {
            if (c == '#') {
                state = State.LINE_COMMENT;
                pos++;
                return;
            }
            if ((c == '\'' || c == '"') && startsWith(c, 3)) {
                out.append(c).append(c).append(c);
                state = c == '\'' ? State.TRIPLE_SINGLE : State.TRIPLE_DOUBLE;
                pos += 3;
                return;
            }
        } else {
            if (c == '/' && peek(1) == '/') {
                state = State.LINE_COMMENT;
                pos += 2;
                return;
            }
            if (c == '/' && peek(1) == '*') {
                out.append(' ');
                state = State.BLOCK_COMMENT;
                pos += 2;
                return;
            }
            if (c == '`') {
                out.append(c);
                state = State.TEMPLATE;
                pos++;
                return;
            }
        }
        if (c == '\'') {
            state = State.SINGLE;
        } else if (c == '"') {
            state = State.DOUBLE;
        }
        out.append(c);
        pos++;
    }

    private void lineComment(final char c) {
        if (c == '\n') {
            out.append(c);
            state = State.NORMAL;
        }
        pos++;
    }

    private void blockComment(final char c) {
        if (c == '*' && peek(1) == '/') {
            state = State.NORMAL;
            pos += 2;
            return;
        }
        if (c == '\n') {
            out.append(c);
        }
        pos++;
    }

    private void quoted(final char c, final char quote) {
        if (c == '\\') {
            escape();
            return;
        }
        if (c == quote || c == '\n') {
            // An unterminated literal ends at the line break.
            out.append(c);
            state = State.NORMAL;
            pos++;
            return;
        }
        content(c);
        pos++;
    }

    private void tripleQuoted(final char c, final char quote) {
        if (c == '\\') {
            escape();
            return;
        }
        if (c == quote && startsWith(quote, 3)) {
            out.append(quote).append(quote).append(quote);
            state = State.NORMAL;
            pos += 3;
            return;
        }
        content(c);
        pos++;
    }

    private void template(final char c) {
        if (c == '\\') {
            escape();
            return;
        }
        if (c == '`') {
            if (interpolations.isEmpty()) {
                out.append(c);
                state = State.NORMAL;
            } else {
                content(c);
                state = State.INTERPOLATION;
            }
            pos++;
            return;
        }
        if (c == '$' && peek(1) == '{') {
            content(c);
            content('{');
            interpolations.push(1);
            state = State.INTERPOLATION;
            pos += 2;
            return;
        }
        content(c);
        pos++;
    }

    private void interpolation(final char c) {
        if (c == '{') {
            interpolations.push(interpolations.pop() + 1);
        } else if (c == '}') {
            final int depth = interpolations.pop() - 1;
            if (depth == 0) {
                state = State.TEMPLATE;
            } else {
                interpolations.push(depth);
            }
        } else if (c == '`') {
            state = State.TEMPLATE;
        } else if (c == '\'' || c == '"') {
            content(c);
            pos++;
            skipNestedLiteral(c);
            return;
        }
        content(c);
        pos++;
    }

    private void skipNestedLiteral(final char quote) {
        while (pos < code.length()) {
            final char c = code.charAt(pos);
            if (c == '\\') {
                escape();
                continue;
            }
            content(c);
            pos++;
            if (c == quote || c == '\n') {
                return;
            }
        }
    }

    private void escape() {
        content(code.charAt(pos));
        if (pos + 1 < code.length()) {
            content(code.charAt(pos + 1));
        }
        pos += 2;
    }

    private void content(final char c) {
        if (keepStrings || c == '\n') {
            out.append(c);
        }
    }

    private char peek(final int offset) {
        final int index = pos + offset;
        return index < code.length() ? code.charAt(index) : '\0';
    }

    private boolean startsWith(final char c, final int count) {
        for (int i = 0; i < count; i++) {
            if (peek(i) != c) {
                return false;
            }
        }
        return true;
    }

}
