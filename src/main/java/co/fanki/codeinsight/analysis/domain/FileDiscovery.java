package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Expands a project root into the list of files to analyze.
 *
 * <p>Keeps regular files whose extension is allowed by
 * {@link AnalysisConfig#languages()}, or one of the built-in source
 * extensions when that list is empty. Vendor and build output
 * directories are always pruned from the walk; test files and test directories are skipped unless the
 * configuration includes tests. Caller ignore globs are matched against
 * the path relative to the root, with {@code /} separators.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FileDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(
            FileDiscovery.class);

    /** Directories never descended into. */
    private static final Set<String> EXCLUDED_DIRS = Set.of(
            "node_modules", "dist", "build", ".git", "coverage");

    /** Directories skipped unless tests are included. */
    private static final Set<String> TEST_DIRS = Set.of(
            "test", "tests", "__tests__");

    /**
     * Discovers the files to analyze under the given root.
     *
     * @param root the project root directory
     * @param config the run configuration
     * @param token the cancellation token of the run
     * @return sorted, distinct absolute paths
     * @throws PathNotFoundException if the root does not exist or cannot be
     *     read
     * @throws AnalysisCancelledException if the run was cancelled
     */
    public List<Path> discover(final Path root, final AnalysisConfig config,
            final CancellationToken token) {
        Preconditions.requireNonNull(root, "Root is required");
        Preconditions.requireNonNull(config, "Config is required");
        Preconditions.requireNonNull(token, "Token is required");

        final Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base) || !Files.isReadable(base)) {
            throw new PathNotFoundException(root.toString());
        }
        token.throwIfCancelled("discovering " + base);

        final Set<String> extensions = allowedExtensions(config);
        final List<PathMatcher> ignores = ignoreMatchers(
                config.ignorePatterns());

        final FileCollector collector = new FileCollector(base, token,
                file -> {
                    final Path relative = base.relativize(file);
                    return extensions.contains(FileAnalyzer.extensionOf(
                                    file.getFileName().toString()))
                            && (config.includeTests() || !isTestPath(relative))
                            && !isIgnored(relative, ignores);
                });
        try {
            Files.walkFileTree(base, collector);
        } catch (final IOException e) {
            throw new PathNotFoundException(root.toString(), e);
        }

        final List<Path> files = collector.files().stream()
                .map(p -> p.toAbsolutePath().normalize())
                .sorted()
                .distinct()
                .toList();
        LOG.debug("Discovered {} files under {}", files.size(), base);
        return files;
    }

    /**
     * Computes the extensions this configuration discovers.
     *
     * <p>An empty language list means the built-in source extensions; a
     * non-empty one is used as given, restricted to the formats the
     * analyzer can read.</p>
     *
     * @param config the run configuration
     * @return the allowed lowercase extensions
     */
    static Set<String> allowedExtensions(final AnalysisConfig config) {
        if (config.languages().isEmpty()) {
            return new LinkedHashSet<>(AnalysisConfig.DEFAULT_LANGUAGES);
        }
        final Set<String> allowed = new LinkedHashSet<>(config.languages());
        allowed.retainAll(LanguageKind.textExtensions());
        return allowed;
    }

    /**
     * Checks whether the given file name or root-relative path looks like
     * a test.
     *
     * @param relative the path relative to the project root
     * @return true for {@code *.test.*}, {@code *.spec.*} and files below
     *     a test directory
     */
    static boolean isTestPath(final Path relative) {
        final String fileName = relative.getFileName().toString();
        if (fileName.contains(".test.") || fileName.contains(".spec.")) {
            return true;
        }
        final Path parent = relative.getParent();
        if (parent == null) {
            return false;
        }
        for (final Path segment : parent) {
            if (TEST_DIRS.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> ignoreMatchers(
            final List<String> patterns) {
        final List<PathMatcher> matchers = new ArrayList<>();
        for (final String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            final String glob = pattern.trim();
            matchers.add(FileSystems.getDefault()
                    .getPathMatcher("glob:" + glob));
            // A leading **/ also matches at the root itself.
            if (glob.startsWith("**/") && glob.length() > 3) {
                matchers.add(FileSystems.getDefault()
                        .getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        return matchers;
    }

    private static boolean isIgnored(final Path relative,
            final List<PathMatcher> matchers) {
        if (matchers.isEmpty()) {
            return false;
        }
        final Path unixStyle = Path.of(relative.toString()
                .replace('\\', '/'));
        for (final PathMatcher matcher : matchers) {
            if (matcher.matches(unixStyle)
                    || matcher.matches(unixStyle.getFileName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Walks the tree collecting accepted files.
     *
     * <p>Excluded directories are pruned instead of enumerated. Entries
     * below the root that cannot be read are logged and skipped; only a
     * failure on the root itself ends the walk.</p>
     */
    static final class FileCollector extends SimpleFileVisitor<Path> {

        private final Path base;
        private final CancellationToken token;
        private final Predicate<Path> accept;
        private final List<Path> files = new ArrayList<>();

        FileCollector(final Path theBase, final CancellationToken theToken,
                final Predicate<Path> theAccept) {
            this.base = theBase;
            this.token = theToken;
            this.accept = theAccept;
        }

        List<Path> files() {
            return files;
        }

        @Override
        public FileVisitResult preVisitDirectory(final Path dir,
                final BasicFileAttributes attrs) {
            token.throwIfCancelled("discovering " + base);
            if (!dir.equals(base) && dir.getFileName() != null
                    && EXCLUDED_DIRS.contains(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(final Path file,
                final BasicFileAttributes attrs) {
            token.throwIfCancelled("discovering " + base);
            if (Files.isRegularFile(file) && accept.test(file)) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(final Path file,
                final IOException exc) throws IOException {
            if (file.equals(base)) {
                throw exc;
            }
            LOG.warn("Skipping unreadable {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(final Path dir,
                final IOException exc) {
            if (exc != null) {
                LOG.warn("Error listing {}: {}", dir, exc.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }
    }

}
