package co.fanki.codeinsight.analysis.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds TODO, FIXME, HACK and NOTE annotations in comments.
 *
 * <p>Works line by line on any text file regardless of language. The
 * marker must directly follow a {@code //}, {@code #} or {@code /*}
 * opener; at most one annotation is reported per line.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TodoExtractor {

    private static final String MARKERS = "(TODO|FIXME|HACK|NOTE)";

    /** Line comments: {@code // TODO: ...} and {@code # FIXME ...}. */
    private static final Pattern LINE_COMMENT = Pattern.compile(
            "(?://|#)\\s*" + MARKERS + "\\b[\\s:]*(.+)",
            Pattern.CASE_INSENSITIVE);

    /** Block comment openers, closed on the same line or not. */
    private static final Pattern BLOCK_COMMENT = Pattern.compile(
            "/\\*\\s*" + MARKERS + "\\b[\\s:]*(.+?)(?:\\*/|$)",
            Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> PATTERNS = List.of(
            LINE_COMMENT, BLOCK_COMMENT);

    private TodoExtractor() {
    }

    /**
     * Extracts every annotation from the given text.
     *
     * @param content the file content, may be null
     * @return the annotations in line order, never null
     */
    public static List<TodoComment> extractTodos(final String content) {
        final List<TodoComment> todos = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return todos;
        }
        final String[] lines = content.split("\\r?\\n", -1);
        for (int i = 0; i < lines.length; i++) {
            final TodoComment todo = extractFromLine(lines[i], i + 1);
            if (todo != null) {
                todos.add(todo);
            }
        }
        return todos;
    }

    private static TodoComment extractFromLine(final String line,
            final int lineNumber) {
        for (final Pattern pattern : PATTERNS) {
            final Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                final String body = clean(matcher.group(2));
                if (!body.isEmpty()) {
                    return TodoComment.of(TodoType.fromMarker(
                            matcher.group(1)), body, lineNumber);
                }
            }
        }
        return null;
    }

    private static String clean(final String raw) {
        String body = raw.trim();
        if (body.endsWith("*/")) {
            body = body.substring(0, body.length() - 2).trim();
        }
        return body;
    }

}
