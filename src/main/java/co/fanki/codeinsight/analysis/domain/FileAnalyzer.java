package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Analyzes a single file according to the requested depth.
 *
 * <p>Files whose extension is not a known text format, or that are larger
 * than {@link AnalysisConfig#maxFileSize()}, are reported with their file
 * system facts only. This is a normal outcome, not an error.</p>
 *
 * <p>Content read or extraction failures are logged and the partially
 * populated analysis is returned, so one bad file never aborts a batch.
 * Cancellation is the exception: it always propagates.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FileAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            FileAnalyzer.class);

    /**
     * Analyzes one file.
     *
     * @param file the file to analyze
     * @param config the run configuration
     * @param token the cancellation token of the run
     * @return the analysis, never null
     * @throws UncheckedIOException if the file cannot be stat-ed
     * @throws AnalysisCancelledException if the run was cancelled
     */
    public FileAnalysis analyze(final Path file, final AnalysisConfig config,
            final CancellationToken token) {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(config, "Config is required");
        Preconditions.requireNonNull(token, "Token is required");

        final Path absolute = file.toAbsolutePath().normalize();
        final String path = absolute.toString();
        final String name = absolute.getFileName().toString();
        final String type = extensionOf(name);

        final long size;
        try {
            size = Files.size(absolute);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot stat " + path, e);
        }

        final LanguageKind kind = LanguageKind.fromExtension(type);
        if (!kind.isText() || size > config.maxFileSize()) {
            LOG.debug("Skipping content of {} ({} bytes, kind {})",
                    path, size, kind);
            return FileAnalysis.unread(path, name, type, size);
        }

        final AnalysisDepth depth = config.analysisDepth();
        int linesOfCode = 0;
        PatternExtractor.Extraction extraction = null;
        int complexity = 0;
        try {
            token.throwIfCancelled("reading " + path);
            // Malformed bytes decode to U+FFFD instead of failing the read.
            final String content = new String(Files.readAllBytes(absolute),
                    StandardCharsets.UTF_8);
            linesOfCode = countLinesOfCode(content);

            if (depth.extractsStructure()) {
                extraction = PatternExtractor.extract(content, kind);
            }
            if (depth.estimatesComplexity()
                    && kind.rules().complexity().isPresent()) {
                complexity = kind.rules().complexity().get()
                        .estimate(content);
            }
        } catch (final AnalysisCancelledException e) {
            throw e;
        } catch (final IOException | RuntimeException e) {
            LOG.warn("Failed to analyze {}: {}", path, e.getMessage());
        }

        if (extraction == null) {
            return new FileAnalysis(path, name, type, size, linesOfCode,
                    List.of(), List.of(), List.of(), List.of(), complexity);
        }
        return new FileAnalysis(path, name, type, size, linesOfCode,
                extraction.functions(), extraction.imports(),
                extraction.exports(), extraction.todos(), complexity);
    }

    /**
     * Counts the non-blank lines of the given text.
     *
     * @param content the text, may be null
     * @return the number of lines with at least one non-whitespace char
     */
    public static int countLinesOfCode(final String content) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        return (int) content.lines().filter(line -> !line.isBlank()).count();
    }

    /**
     * Returns the lowercase extension of a file name.
     *
     * @param fileName the file name
     * @return the extension without dot, or {@link FileAnalysis#UNKNOWN_TYPE}
     */
    public static String extensionOf(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return FileAnalysis.UNKNOWN_TYPE;
        }
        return fileName.substring(dot + 1).toLowerCase();
    }

}
