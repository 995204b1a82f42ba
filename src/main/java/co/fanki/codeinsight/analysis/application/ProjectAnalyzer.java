package co.fanki.codeinsight.analysis.application;

import co.fanki.codeinsight.analysis.domain.AnalysisConfig;
import co.fanki.codeinsight.analysis.domain.ArchitectureDetector;
import co.fanki.codeinsight.analysis.domain.CancellationToken;
import co.fanki.codeinsight.analysis.domain.DependencyEdge;
import co.fanki.codeinsight.analysis.domain.DependencyGraphBuilder;
import co.fanki.codeinsight.analysis.domain.FileAnalysis;
import co.fanki.codeinsight.analysis.domain.FileDiscovery;
import co.fanki.codeinsight.analysis.domain.MetricsCalculator;
import co.fanki.codeinsight.analysis.domain.PathNotFoundException;
import co.fanki.codeinsight.analysis.domain.ProjectAnalysis;
import co.fanki.codeinsight.analysis.domain.ProjectMetrics;
import co.fanki.codeinsight.analysis.domain.TodoComment;
import co.fanki.codeinsight.shared.DomainException;
import co.fanki.codeinsight.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Orchestrates one analysis run.
 *
 * <p>Flow: validate root -> discover files -> analyze them in batches ->
 * compute metrics, architecture patterns and the dependency graph in
 * parallel -> flatten TODOs -> assemble the {@link ProjectAnalysis}.</p>
 *
 * <p>Stateless between runs; caching and de-duplication of concurrent
 * requests live in {@link CodeAnalysisService}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProjectAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectAnalyzer.class);

    private final FileDiscovery fileDiscovery;
    private final BatchRunner batchRunner;
    private final MetricsCalculator metricsCalculator;
    private final ArchitectureDetector architectureDetector;
    private final DependencyGraphBuilder dependencyGraphBuilder;
    private final ExecutorService aggregationExecutor;
    private final Clock clock;

    /**
     * Creates a new ProjectAnalyzer.
     *
     * @param theFileDiscovery the file discovery
     * @param theBatchRunner the batch runner
     * @param theMetricsCalculator the metrics calculator
     * @param theArchitectureDetector the architecture detector
     * @param theDependencyGraphBuilder the dependency graph builder
     * @param theAggregationExecutor the pool the aggregations run on
     * @param theClock the clock stamping finished analyses
     */
    public ProjectAnalyzer(
            final FileDiscovery theFileDiscovery,
            final BatchRunner theBatchRunner,
            final MetricsCalculator theMetricsCalculator,
            final ArchitectureDetector theArchitectureDetector,
            final DependencyGraphBuilder theDependencyGraphBuilder,
            @Qualifier("aggregationExecutor")
            final ExecutorService theAggregationExecutor,
            final Clock theClock) {
        this.fileDiscovery = theFileDiscovery;
        this.batchRunner = theBatchRunner;
        this.metricsCalculator = theMetricsCalculator;
        this.architectureDetector = theArchitectureDetector;
        this.dependencyGraphBuilder = theDependencyGraphBuilder;
        this.aggregationExecutor = theAggregationExecutor;
        this.clock = theClock;
    }

    /**
     * Analyzes a project without progress reporting.
     *
     * @param projectRoot the project root directory
     * @param config the run configuration
     * @param token the cancellation token
     * @return the analysis
     * @throws PathNotFoundException if the root does not exist
     */
    public ProjectAnalysis analyze(final Path projectRoot,
            final AnalysisConfig config, final CancellationToken token) {
        return analyze(projectRoot, config, ProgressListener.NONE, token);
    }

    /**
     * Analyzes a project, reporting progress.
     *
     * <p>The listener receives 0 when the run starts, one update per
     * analyzed file and a final 100 once the aggregations are done.</p>
     *
     * @param projectRoot the project root directory
     * @param config the run configuration
     * @param listener the progress listener
     * @param token the cancellation token
     * @return the analysis
     * @throws PathNotFoundException if the root does not exist
     */
    public ProjectAnalysis analyze(final Path projectRoot,
            final AnalysisConfig config, final ProgressListener listener,
            final CancellationToken token) {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        Preconditions.requireNonNull(config, "Config is required");
        Preconditions.requireNonNull(listener, "Listener is required");
        Preconditions.requireNonNull(token, "Token is required");

        final Path root = projectRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new PathNotFoundException(projectRoot.toString());
        }
        final String rootPath = root.toString();

        LOG.info("Starting analysis of {} (depth {}, tests {})", rootPath,
                config.analysisDepth(), config.includeTests());
        final long start = System.currentTimeMillis();
        listener.onProgress(0, "Starting analysis");

        final List<Path> paths = fileDiscovery.discover(root, config, token);
        LOG.info("Discovered {} files in {}", paths.size(), rootPath);

        final List<FileAnalysis> files = batchRunner.run(paths, config,
                listener, token);
        token.throwIfCancelled("aggregating " + rootPath);

        final CompletableFuture<ProjectMetrics> metrics =
                CompletableFuture.supplyAsync(() -> metricsCalculator
                        .calculateProjectMetrics(rootPath, files),
                        aggregationExecutor);
        final CompletableFuture<List<String>> patterns =
                CompletableFuture.supplyAsync(() -> architectureDetector
                        .detectPatterns(rootPath, files),
                        aggregationExecutor);
        final CompletableFuture<List<DependencyEdge>> dependencies =
                CompletableFuture.supplyAsync(() -> dependencyGraphBuilder
                        .build(files), aggregationExecutor);

        final ProjectAnalysis analysis = new ProjectAnalysis(rootPath, files,
                join(dependencies), join(metrics), join(patterns),
                flattenTodos(files), clock.instant());

        listener.onProgress(100, "Analysis complete");
        LOG.info("Analysis of {} completed in {} ms: {} files, {} lines, "
                        + "{} dependencies, patterns {}",
                rootPath, System.currentTimeMillis() - start,
                analysis.metrics().totalFiles(),
                analysis.metrics().totalLines(),
                analysis.dependencies().size(),
                analysis.architecturePatterns());
        return analysis;
    }

    private static List<TodoComment> flattenTodos(
            final List<FileAnalysis> files) {
        final List<TodoComment> todos = new ArrayList<>();
        for (final FileAnalysis file : files) {
            for (final TodoComment todo : file.todos()) {
                todos.add(todo.locatedIn(file.path()));
            }
        }
        return todos;
    }

    private static <T> T join(final CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (final CompletionException e) {
            final Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof DomainException) {
                throw (DomainException) cause;
            }
            LOG.error("Aggregation failed: {}", cause.getMessage(), cause);
            throw new DomainException("Aggregation failed: "
                    + cause.getMessage(), DomainException.INTERNAL_ERROR,
                    cause);
        }
    }

}
