package co.fanki.codeinsight.analysis.application;

import co.fanki.codeinsight.analysis.application.CodeAnalysisService.QuickStats;
import co.fanki.codeinsight.analysis.domain.AnalysisCache;
import co.fanki.codeinsight.analysis.domain.AnalysisConfig;
import co.fanki.codeinsight.analysis.domain.AnalysisDepth;
import co.fanki.codeinsight.analysis.domain.CancellationToken;
import co.fanki.codeinsight.analysis.domain.FileAnalysis;
import co.fanki.codeinsight.analysis.domain.FileAnalyzer;
import co.fanki.codeinsight.analysis.domain.FileDiscovery;
import co.fanki.codeinsight.analysis.domain.MetricsCalculator;
import co.fanki.codeinsight.analysis.domain.PathNotFoundException;
import co.fanki.codeinsight.analysis.domain.ProjectAnalysis;
import co.fanki.codeinsight.analysis.domain.ProjectHealthReport;
import co.fanki.codeinsight.analysis.domain.ProjectMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CodeAnalysisService}.
 *
 * <p>The orchestrator is mocked so the tests observe how often a real run
 * would be started.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CodeAnalysisServiceTest {

    @TempDir
    Path projectDir;

    private Path root;

    private ProjectAnalyzer projectAnalyzer;

    private AnalysisCache cache;

    private CodeAnalysisService service;

    @BeforeEach
    void setUp() {
        root = projectDir.toAbsolutePath().normalize();
        projectAnalyzer = createMock(ProjectAnalyzer.class);
        cache = new AnalysisCache(10, Duration.ofMinutes(30),
                Clock.systemUTC());
        service = new CodeAnalysisService(projectAnalyzer, new FileDiscovery(),
                new FileAnalyzer(), new MetricsCalculator(), cache);
    }

    @Test
    void whenAnalyzingTwice_givenSameKey_shouldRunOnce() {
        final AnalysisConfig config = AnalysisConfig.defaults();
        final ProjectAnalysis analysis = analysis(projectDir.toString());
        expect(projectAnalyzer.analyze(eq(root), eq(config),
                anyObject(CancellationToken.class)))
                .andReturn(analysis).once();
        replay(projectAnalyzer);

        final ProjectAnalysis first = service.analyze(projectDir.toString(),
                config);
        final ProjectAnalysis second = service.analyze(
                projectDir.resolve(".").toString(), config);

        assertSame(analysis, first);
        assertSame(first, second);
        verify(projectAnalyzer);
    }

    @Test
    void whenAnalyzing_givenDifferentDepth_shouldRunAgain() {
        final AnalysisConfig medium = AnalysisConfig.defaults();
        final AnalysisConfig deep = medium.withDepth(AnalysisDepth.DEEP);
        expect(projectAnalyzer.analyze(eq(root), eq(medium),
                anyObject(CancellationToken.class)))
                .andReturn(analysis(projectDir.toString()));
        expect(projectAnalyzer.analyze(eq(root), eq(deep),
                anyObject(CancellationToken.class)))
                .andReturn(analysis(projectDir.toString()));
        replay(projectAnalyzer);

        service.analyze(projectDir.toString(), medium);
        service.analyze(projectDir.toString(), deep);

        assertEquals(2, cache.size());
        verify(projectAnalyzer);
    }

    @Test
    void whenAnalyzing_givenFailure_shouldNotCacheAndRethrow() {
        final AnalysisConfig config = AnalysisConfig.defaults();
        expect(projectAnalyzer.analyze(eq(root), eq(config),
                anyObject(CancellationToken.class)))
                .andThrow(new PathNotFoundException(projectDir.toString()));
        replay(projectAnalyzer);

        assertThrows(PathNotFoundException.class,
                () -> service.analyze(projectDir.toString(), config));

        assertEquals(0, cache.size());
        verify(projectAnalyzer);
    }

    @Test
    void whenAnalyzingConcurrently_givenSameKey_shouldShareOneRun()
            throws Exception {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger runs = new AtomicInteger();
        final ProjectAnalysis analysis = analysis(projectDir.toString());

        final ProjectAnalyzer blocking = new ProjectAnalyzer(null, null, null,
                null, null, null, null) {
            @Override
            public ProjectAnalysis analyze(final Path projectRoot,
                    final AnalysisConfig config,
                    final CancellationToken token) {
                runs.incrementAndGet();
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return analysis;
            }
        };
        final CodeAnalysisService shared = new CodeAnalysisService(blocking,
                new FileDiscovery(), new FileAnalyzer(),
                new MetricsCalculator(), cache);

        final ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            final Future<ProjectAnalysis> owner = callers.submit(
                    () -> shared.analyze(projectDir.toString(),
                            AnalysisConfig.defaults()));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            final Future<ProjectAnalysis> joiner = callers.submit(
                    () -> shared.analyze(projectDir.toString(),
                            AnalysisConfig.defaults()));
            release.countDown();

            assertSame(analysis, owner.get(5, TimeUnit.SECONDS));
            assertSame(analysis, joiner.get(5, TimeUnit.SECONDS));
            assertEquals(1, runs.get());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void whenAnalyzingWithProgress_shouldBypassAndRefreshCache() {
        final AnalysisConfig config = AnalysisConfig.defaults();
        final ProjectAnalysis stale = analysis(projectDir.toString());
        final ProjectAnalysis fresh = analysis(projectDir.toString());
        cache.put(AnalysisCache.CacheKey.of(projectDir.toString(), config),
                stale);
        expect(projectAnalyzer.analyze(eq(root), eq(config),
                eq(ProgressListener.NONE), anyObject(CancellationToken.class)))
                .andReturn(fresh);
        replay(projectAnalyzer);

        final ProjectAnalysis result = service.analyzeWithProgress(
                projectDir.toString(), config, ProgressListener.NONE);

        assertSame(fresh, result);
        assertSame(fresh, service.analyze(projectDir.toString(), config));
        verify(projectAnalyzer);
    }

    @Test
    void whenClearingCache_givenProjectOrNothing_shouldReturnRemovedCount() {
        final AnalysisConfig config = AnalysisConfig.defaults();
        cache.put(AnalysisCache.CacheKey.of("/p/shop", config),
                analysis("/p/shop"));
        cache.put(AnalysisCache.CacheKey.of("/p/shop",
                config.withIncludeTests(true)), analysis("/p/shop"));
        cache.put(AnalysisCache.CacheKey.of("/p/blog", config),
                analysis("/p/blog"));

        assertEquals(2, service.clearCache("/p/shop"));
        assertEquals(0, service.clearCache("/p/unknown"));
        assertEquals(1, service.clearCache(null));
        assertEquals(0, cache.size());
    }

    @Test
    void whenAnalyzingFile_givenExistingFile_shouldUseRequestedDepth()
            throws IOException {
        final Path file = projectDir.resolve("util.js");
        Files.writeString(file, """
                function check(a, b) {
                  if (a && b) {
                    return 1;
                  }
                  return 0;
                }
                """);

        final FileAnalysis analysis = service.analyzeFile(file.toString(),
                AnalysisDepth.DEEP);

        assertEquals("js", analysis.type());
        assertEquals(6, analysis.linesOfCode());
        assertEquals(List.of("check"), analysis.functions());
        assertEquals(3, analysis.complexity());
    }

    @Test
    void whenAnalyzingFile_givenMissingFile_shouldThrowPathNotFound() {
        assertThrows(PathNotFoundException.class,
                () -> service.analyzeFile(
                        projectDir.resolve("nope.ts").toString(),
                        AnalysisDepth.MEDIUM));
    }

    @Test
    void whenAnalyzingFile_givenDirectory_shouldThrowPathNotFound() {
        assertThrows(PathNotFoundException.class,
                () -> service.analyzeFile(projectDir.toString(),
                        AnalysisDepth.MEDIUM));
    }

    @Test
    void whenGettingQuickStats_shouldCountWithoutReading() throws IOException {
        Files.writeString(projectDir.resolve("a.ts"), "const a = 1;\n");
        Files.writeString(projectDir.resolve("b.py"), "b = 2\n");
        Files.writeString(projectDir.resolve("notes.md"), "# notes\n");
        Files.createDirectories(projectDir.resolve("node_modules"));
        Files.writeString(projectDir.resolve("node_modules/x.js"), "x\n");

        final QuickStats stats = service.quickStats(projectDir.toString());

        assertEquals(2, stats.fileCount());
        assertEquals(List.of("py", "ts"), List.copyOf(stats.languages()));
        assertEquals(19, stats.estimatedSizeBytes());
    }

    @Test
    void whenCreatingQuickStats_shouldNotExposeCallerSet() {
        final SortedSet<String> languages = new TreeSet<>(List.of("ts"));

        final QuickStats stats = new QuickStats(1, languages, 10);
        languages.add("py");

        assertEquals(List.of("ts"), List.copyOf(stats.languages()));
        assertThrows(UnsupportedOperationException.class,
                () -> stats.languages().add("js"));
    }

    @Test
    void whenGettingQuickStats_givenMissingRoot_shouldThrowPathNotFound() {
        assertThrows(PathNotFoundException.class,
                () -> service.quickStats(
                        projectDir.resolve("missing").toString()));
    }

    @Test
    void whenComputingHealthReport_shouldUseAnalysisFiles() {
        final String base = root.toString();
        final FileAnalysis small = new FileAnalysis(base + "/a.ts", "a.ts",
                "ts", 10, 20, List.of("a"), List.of(), List.of(), List.of(),
                2);
        final FileAnalysis huge = new FileAnalysis(base + "/b.ts", "b.ts",
                "ts", 10, 1200, List.of("b"), List.of(), List.of(), List.of(),
                4);
        final ProjectAnalysis analysis = new ProjectAnalysis(base,
                List.of(small, huge), List.of(), ProjectMetrics.empty(),
                List.of(), List.of(), Instant.now());

        final ProjectHealthReport report = service.healthReport(analysis);

        assertEquals(1, report.sizeDistribution().small());
        assertEquals(1, report.sizeDistribution().huge());
        assertEquals(2, report.sizeDistribution().total());
    }

    private static ProjectAnalysis analysis(final String path) {
        return new ProjectAnalysis(path, List.of(), List.of(),
                ProjectMetrics.empty(), List.of(), List.of(), Instant.now());
    }

}
