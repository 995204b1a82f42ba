package co.fanki.codeinsight.analysis.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link FileDiscovery}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FileDiscoveryTest {

    private final FileDiscovery discovery = new FileDiscovery();

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws IOException {
        touch("src/index.ts");
        touch("src/app.jsx");
        touch("src/util.py");
        touch("src/styles.css");
        touch("src/index.test.ts");
        touch("src/button.spec.js");
        touch("src/__tests__/app.js");
        touch("tests/test_util.py");
        touch("node_modules/react/index.js");
        touch("dist/bundle.js");
        touch("build/out.js");
        touch("coverage/report.json");
        touch(".git/hooks/pre-commit.js");
        touch("generated/api.ts");
        touch("README.md");
        touch("Main.java");
    }

    @Test
    void whenDiscovering_givenDefaults_shouldSkipTestsVendorAndUnknown() {
        final List<Path> files = discovery.discover(root,
                AnalysisConfig.defaults(), CancellationToken.none());

        assertEquals(relative("generated/api.ts", "src/app.jsx",
                "src/index.ts", "src/styles.css", "src/util.py"), files);
    }

    @Test
    void whenDiscovering_givenIncludeTests_shouldKeepTestFiles() {
        final List<Path> files = discovery.discover(root,
                AnalysisConfig.defaults().withIncludeTests(true),
                CancellationToken.none());

        assertEquals(relative("generated/api.ts", "src/__tests__/app.js",
                "src/app.jsx", "src/button.spec.js", "src/index.test.ts",
                "src/index.ts", "src/styles.css", "src/util.py",
                "tests/test_util.py"), files);
    }

    @Test
    void whenDiscovering_givenIgnorePattern_shouldSkipMatchingPaths() {
        final List<Path> files = discovery.discover(root,
                AnalysisConfig.defaults()
                        .withIgnorePatterns(List.of("**/generated/**", "*.css")),
                CancellationToken.none());

        assertEquals(relative("src/app.jsx", "src/index.ts", "src/util.py"),
                files);
    }

    @Test
    void whenDiscovering_givenLanguageAllowList_shouldKeepOnlyThoseTypes() {
        final List<Path> files = discovery.discover(root,
                AnalysisConfig.defaults().withLanguages(List.of(".py", "md")),
                CancellationToken.none());

        assertEquals(relative("README.md", "src/util.py"), files);
    }

    @Test
    void whenDiscovering_givenMissingRoot_shouldThrowPathNotFound() {
        final PathNotFoundException e = assertThrows(
                PathNotFoundException.class,
                () -> discovery.discover(root.resolve("nope"),
                        AnalysisConfig.defaults(), CancellationToken.none()));

        assertEquals(PathNotFoundException.CODE, e.getErrorCode());
    }

    @Test
    void whenDiscovering_givenCancelledToken_shouldThrowCancelled() {
        final CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(AnalysisCancelledException.class,
                () -> discovery.discover(root, AnalysisConfig.defaults(),
                        token));
    }

    @Test
    void whenWalking_givenUnreadableEntryBelowRoot_shouldSkipIt()
            throws IOException {
        final FileDiscovery.FileCollector collector =
                new FileDiscovery.FileCollector(root, CancellationToken.none(),
                        file -> true);

        final FileVisitResult result = collector.visitFileFailed(
                root.resolve("secret"),
                new AccessDeniedException(root.resolve("secret").toString()));

        assertEquals(FileVisitResult.CONTINUE, result);
        assertEquals(FileVisitResult.CONTINUE, collector.postVisitDirectory(
                root.resolve("src"), new IOException("listing failed")));
    }

    @Test
    void whenWalking_givenUnreadableRoot_shouldFail() {
        final FileDiscovery.FileCollector collector =
                new FileDiscovery.FileCollector(root, CancellationToken.none(),
                        file -> true);

        assertThrows(AccessDeniedException.class,
                () -> collector.visitFileFailed(root,
                        new AccessDeniedException(root.toString())));
    }

    @Test
    void whenWalking_givenExcludedDirectory_shouldPruneIt() {
        final FileDiscovery.FileCollector collector =
                new FileDiscovery.FileCollector(root, CancellationToken.none(),
                        file -> true);

        assertEquals(FileVisitResult.SKIP_SUBTREE, collector.preVisitDirectory(
                root.resolve("node_modules"), null));
        assertEquals(FileVisitResult.CONTINUE, collector.preVisitDirectory(
                root.resolve("src"), null));
    }

    @Test
    void whenDiscovering_givenRootNamedLikeExcludedDir_shouldStillWalkIt()
            throws IOException {
        final Path build = root.resolve("build");
        Files.writeString(build.resolve("main.ts"), "");

        final List<Path> files = discovery.discover(build,
                AnalysisConfig.defaults(), CancellationToken.none());

        assertEquals(List.of(build.resolve("main.ts").toAbsolutePath()
                .normalize(), build.resolve("out.js").toAbsolutePath()
                .normalize()), files);
    }

    private List<Path> relative(final String... paths) {
        final Path base = root.toAbsolutePath().normalize();
        return Arrays.stream(paths)
                .map(base::resolve)
                .sorted()
                .toList();
    }

    private void touch(final String relativePath) throws IOException {
        final Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "// " + relativePath + "\n");
    }

}
