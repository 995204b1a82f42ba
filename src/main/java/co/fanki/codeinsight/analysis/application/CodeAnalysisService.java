package co.fanki.codeinsight.analysis.application;

import co.fanki.codeinsight.analysis.domain.AnalysisCache;
import co.fanki.codeinsight.analysis.domain.AnalysisCache.CacheKey;
import co.fanki.codeinsight.analysis.domain.AnalysisCancelledException;
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
import co.fanki.codeinsight.shared.DomainException;
import co.fanki.codeinsight.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Entry point of the analysis pipeline.
 *
 * <p>Wraps the {@link ProjectAnalyzer} with the {@link AnalysisCache} and
 * a single-flight guard: concurrent {@link #analyze} calls for the same
 * cache key share one run. A key is idle (nothing cached, nothing
 * running), running (a future is registered) or done (the result is
 * cached).</p>
 *
 * <p>Callers joining a running analysis get the result of the run that
 * owns the key, computed with the owner's configuration and cancellation
 * token.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class CodeAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            CodeAnalysisService.class);

    /** How many files {@link #quickStats} stats. */
    private static final int QUICK_STATS_SAMPLE = 100;

    private final ProjectAnalyzer projectAnalyzer;
    private final FileDiscovery fileDiscovery;
    private final FileAnalyzer fileAnalyzer;
    private final MetricsCalculator metricsCalculator;
    private final AnalysisCache cache;

    private final Map<CacheKey, CompletableFuture<ProjectAnalysis>> running =
            new ConcurrentHashMap<>();

    /**
     * Creates a new CodeAnalysisService.
     *
     * @param theProjectAnalyzer the orchestrator
     * @param theFileDiscovery the file discovery, for quick stats
     * @param theFileAnalyzer the per-file analyzer, for single files
     * @param theMetricsCalculator the metrics calculator, for reports
     * @param theCache the analysis cache
     */
    public CodeAnalysisService(
            final ProjectAnalyzer theProjectAnalyzer,
            final FileDiscovery theFileDiscovery,
            final FileAnalyzer theFileAnalyzer,
            final MetricsCalculator theMetricsCalculator,
            final AnalysisCache theCache) {
        this.projectAnalyzer = theProjectAnalyzer;
        this.fileDiscovery = theFileDiscovery;
        this.fileAnalyzer = theFileAnalyzer;
        this.metricsCalculator = theMetricsCalculator;
        this.cache = theCache;
    }

    /**
     * Analyzes a project, serving it from the cache when possible.
     *
     * @param projectPath the project root
     * @param config the run configuration
     * @return the analysis
     * @throws PathNotFoundException if the root does not exist
     */
    public ProjectAnalysis analyze(final String projectPath,
            final AnalysisConfig config) {
        return analyze(projectPath, config, CancellationToken.create());
    }

    /**
     * Analyzes a project, serving it from the cache when possible.
     *
     * @param projectPath the project root
     * @param config the run configuration
     * @param token cancels the run if this call owns it
     * @return the analysis
     * @throws PathNotFoundException if the root does not exist
     * @throws AnalysisCancelledException if the run is cancelled
     */
    public ProjectAnalysis analyze(final String projectPath,
            final AnalysisConfig config, final CancellationToken token) {
        Preconditions.requireNonBlank(projectPath, "Project path is required");
        Preconditions.requireNonNull(config, "Config is required");
        Preconditions.requireNonNull(token, "Token is required");

        final CacheKey key = CacheKey.of(projectPath, config);
        final ProjectAnalysis cached = cache.get(key);
        if (cached != null) {
            LOG.debug("Serving cached analysis for {}", key);
            return cached;
        }

        final CompletableFuture<ProjectAnalysis> mine =
                new CompletableFuture<>();
        final CompletableFuture<ProjectAnalysis> other =
                running.putIfAbsent(key, mine);
        if (other != null) {
            LOG.debug("Joining running analysis for {}", key);
            return await(other, key);
        }

        try {
            // A run may have finished between the lookup and the claim.
            ProjectAnalysis analysis = cache.get(key);
            if (analysis == null) {
                analysis = projectAnalyzer.analyze(
                        Path.of(key.projectPath()), config, token);
                cache.put(key, analysis);
            }
            mine.complete(analysis);
            return analysis;
        } catch (final RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            running.remove(key, mine);
        }
    }

    /**
     * Analyzes a project with live progress, bypassing cached results.
     *
     * <p>The fresh result replaces whatever was cached for the key.</p>
     *
     * @param projectPath the project root
     * @param config the run configuration
     * @param listener the progress listener
     * @param token the cancellation token
     * @return the analysis
     * @throws PathNotFoundException if the root does not exist
     * @throws AnalysisCancelledException if the run is cancelled
     */
    public ProjectAnalysis analyzeWithProgress(final String projectPath,
            final AnalysisConfig config, final ProgressListener listener,
            final CancellationToken token) {
        Preconditions.requireNonBlank(projectPath, "Project path is required");
        Preconditions.requireNonNull(config, "Config is required");

        final CacheKey key = CacheKey.of(projectPath, config);
        final ProjectAnalysis analysis = projectAnalyzer.analyze(
                Path.of(key.projectPath()), config, listener, token);
        cache.put(key, analysis);
        return analysis;
    }

    /**
     * Analyzes a project with live progress and no cancellation.
     *
     * @param projectPath the project root
     * @param config the run configuration
     * @param listener the progress listener
     * @return the analysis
     */
    public ProjectAnalysis analyzeWithProgress(final String projectPath,
            final AnalysisConfig config, final ProgressListener listener) {
        return analyzeWithProgress(projectPath, config, listener,
                CancellationToken.create());
    }

    /**
     * Analyzes a single file.
     *
     * @param filePath the file
     * @param depth the analysis depth
     * @return the file analysis
     * @throws PathNotFoundException if the file does not exist
     */
    public FileAnalysis analyzeFile(final String filePath,
            final AnalysisDepth depth) {
        Preconditions.requireNonBlank(filePath, "File path is required");
        final Path file = Path.of(filePath);
        if (!Files.isRegularFile(file)) {
            throw new PathNotFoundException(filePath);
        }
        final AnalysisConfig config = AnalysisConfig.defaults().withDepth(
                depth == null ? AnalysisDepth.MEDIUM : depth);
        try {
            return fileAnalyzer.analyze(file, config, CancellationToken.none());
        } catch (final UncheckedIOException e) {
            throw new PathNotFoundException(filePath, e);
        }
    }

    /**
     * Returns cheap statistics without analyzing file contents.
     *
     * <p>Runs discovery with the default configuration and stats the first
     * files only; files that cannot be stat-ed are skipped.</p>
     *
     * @param projectPath the project root
     * @return the statistics
     * @throws PathNotFoundException if the root does not exist
     */
    public QuickStats quickStats(final String projectPath) {
        Preconditions.requireNonBlank(projectPath, "Project path is required");
        final List<Path> files = fileDiscovery.discover(Path.of(projectPath),
                AnalysisConfig.defaults(), CancellationToken.none());

        final SortedSet<String> languages = new TreeSet<>();
        long size = 0;
        for (final Path file : files.subList(0,
                Math.min(QUICK_STATS_SAMPLE, files.size()))) {
            try {
                size += Files.size(file);
                languages.add(FileAnalyzer.extensionOf(
                        file.getFileName().toString()));
            } catch (final IOException e) {
                LOG.debug("Cannot stat {}: {}", file, e.getMessage());
            }
        }
        return new QuickStats(files.size(), languages, size);
    }

    /**
     * Clears cached analyses.
     *
     * @param projectPath the project to clear, or null to clear everything
     * @return the number of entries removed
     */
    public int clearCache(final String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            return cache.invalidateAll();
        }
        return cache.invalidate(projectPath);
    }

    /**
     * Computes the derived health reports of an analysis.
     *
     * @param analysis a finished analysis
     * @return the size distribution, debt index and quality score
     */
    public ProjectHealthReport healthReport(final ProjectAnalysis analysis) {
        Preconditions.requireNonNull(analysis, "Analysis is required");
        return metricsCalculator.healthReport(analysis.projectPath(),
                analysis.files());
    }

    private static ProjectAnalysis await(
            final CompletableFuture<ProjectAnalysis> future,
            final CacheKey key) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException(
                    "Interrupted while waiting for " + key, e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new DomainException("Analysis failed: " + cause,
                    DomainException.INTERNAL_ERROR, cause);
        }
    }

    /**
     * Cheap statistics of a project.
     *
     * @param fileCount the number of discovered files
     * @param languages the extensions of the sampled files
     * @param estimatedSizeBytes the total size of the sampled files
     */
    public record QuickStats(
            int fileCount,
            SortedSet<String> languages,
            long estimatedSizeBytes
    ) {

        /** Copies the languages into an unmodifiable set. */
        public QuickStats {
            languages = Collections.unmodifiableSortedSet(
                    languages == null ? new TreeSet<>()
                            : new TreeSet<>(languages));
        }
    }

}
