package co.fanki.codeinsight.config;

import co.fanki.codeinsight.analysis.domain.AnalysisCache;
import co.fanki.codeinsight.analysis.domain.ArchitectureDetector;
import co.fanki.codeinsight.analysis.domain.DependencyGraphBuilder;
import co.fanki.codeinsight.analysis.domain.FileAnalyzer;
import co.fanki.codeinsight.analysis.domain.FileDiscovery;
import co.fanki.codeinsight.analysis.domain.MetricsCalculator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring of the analysis pipeline.
 *
 * <p>The domain components are plain classes; this configuration turns
 * them into singletons and owns the two worker pools. Both pools are shut
 * down when the context closes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    /**
     * Pool the per-file analyses run on, one thread per batch slot.
     *
     * @param width the batch width
     * @return the executor
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(
            @Value("${code-insight.batch.width:10}") final int width) {
        return Executors.newFixedThreadPool(width,
                new CustomizableThreadFactory("analysis-"));
    }

    /**
     * Pool the metrics, pattern and graph aggregations run on.
     *
     * @param threads the number of threads
     * @return the executor
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService aggregationExecutor(
            @Value("${code-insight.aggregation.threads:3}") final int threads) {
        return Executors.newFixedThreadPool(threads,
                new CustomizableThreadFactory("aggregation-"));
    }

    /**
     * The analysis cache.
     *
     * @param maxEntries the maximum number of cached analyses
     * @param ttl how long a cached analysis stays valid
     * @param clock the clock
     * @return the cache
     */
    @Bean
    public AnalysisCache analysisCache(
            @Value("${code-insight.cache.max-entries:50}") final int maxEntries,
            @Value("${code-insight.cache.ttl:30m}") final Duration ttl,
            final Clock clock) {
        return new AnalysisCache(maxEntries, ttl, clock);
    }

    /**
     * The clock stamping analyses and aging cache entries.
     *
     * @return the system UTC clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** @return the file discovery */
    @Bean
    public FileDiscovery fileDiscovery() {
        return new FileDiscovery();
    }

    /** @return the per-file analyzer */
    @Bean
    public FileAnalyzer fileAnalyzer() {
        return new FileAnalyzer();
    }

    /** @return the metrics calculator */
    @Bean
    public MetricsCalculator metricsCalculator() {
        return new MetricsCalculator();
    }

    /** @return the architecture detector */
    @Bean
    public ArchitectureDetector architectureDetector() {
        return new ArchitectureDetector();
    }

    /** @return the dependency graph builder */
    @Bean
    public DependencyGraphBuilder dependencyGraphBuilder() {
        return new DependencyGraphBuilder();
    }

}
