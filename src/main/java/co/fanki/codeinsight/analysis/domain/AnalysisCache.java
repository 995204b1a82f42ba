package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * In-memory cache of completed project analyses.
 *
 * <p>Keyed by (normalized absolute project path, include-tests flag,
 * depth). Backed by a Caffeine cache bounded in two ways: at most
 * {@code maxEntries} analyses are kept, and an entry is dropped once
 * {@code ttl} has passed since it was written.</p>
 *
 * <p>Thread-safe. Maintenance runs on the calling thread, so evictions
 * are visible as soon as the operation that caused them returns.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalysisCache {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisCache.class);

    private final Cache<CacheKey, ProjectAnalysis> cache;

    /**
     * Creates a new AnalysisCache.
     *
     * @param theMaxEntries the maximum number of analyses kept
     * @param theTtl how long an analysis stays valid
     * @param theClock the clock used to age entries
     */
    public AnalysisCache(final int theMaxEntries, final Duration theTtl,
            final Clock theClock) {
        Preconditions.requirePositive(theMaxEntries,
                "Max entries must be positive");
        Preconditions.requireNonNull(theTtl, "TTL is required");
        Preconditions.require(!theTtl.isNegative() && !theTtl.isZero(),
                "TTL must be positive");
        Preconditions.requireNonNull(theClock, "Clock is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(theMaxEntries)
                .expireAfterWrite(theTtl)
                .ticker(() -> ChronoUnit.NANOS.between(Instant.EPOCH,
                        theClock.instant()))
                .executor(Runnable::run)
                .removalListener((CacheKey key, ProjectAnalysis value,
                        RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        LOG.debug("Evicted cached analysis {} ({})", key,
                                cause);
                    }
                })
                .build();
    }

    /**
     * Returns the cached analysis for the given key.
     *
     * @param key the cache key
     * @return the analysis, or null if absent or expired
     */
    public ProjectAnalysis get(final CacheKey key) {
        Preconditions.requireNonNull(key, "Key is required");
        return cache.getIfPresent(key);
    }

    /**
     * Stores an analysis, replacing any previous one for the key.
     *
     * @param key the cache key
     * @param analysis the completed analysis
     */
    public void put(final CacheKey key, final ProjectAnalysis analysis) {
        Preconditions.requireNonNull(key, "Key is required");
        Preconditions.requireNonNull(analysis, "Analysis is required");
        cache.put(key, analysis);
    }

    /**
     * Removes every analysis of the given project, whatever its flags.
     *
     * @param projectPath the project root
     * @return the number of entries removed
     */
    public int invalidate(final String projectPath) {
        Preconditions.requireNonBlank(projectPath,
                "Project path is required");
        final String normalized = CacheKey.normalize(projectPath);
        cache.cleanUp();
        final List<CacheKey> keys = cache.asMap().keySet().stream()
                .filter(key -> key.projectPath().equals(normalized))
                .toList();
        cache.invalidateAll(keys);
        LOG.info("Invalidated {} cached analyses for {}", keys.size(),
                normalized);
        return keys.size();
    }

    /**
     * Removes every cached analysis.
     *
     * @return the number of entries removed
     */
    public int invalidateAll() {
        cache.cleanUp();
        final int removed = (int) cache.estimatedSize();
        cache.invalidateAll();
        LOG.info("Invalidated all {} cached analyses", removed);
        return removed;
    }

    /**
     * Returns the number of live entries, after pending evictions ran.
     *
     * @return the size
     */
    public int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    /**
     * Identity of a cached analysis.
     *
     * <p>Languages, ignore patterns and the size limit are not part of the
     * key; callers that change them should clear the cache.</p>
     *
     * @param projectPath the normalized absolute project root
     * @param includeTests whether tests were analyzed
     * @param depth the analysis depth
     */
    public record CacheKey(
            String projectPath,
            boolean includeTests,
            AnalysisDepth depth
    ) {

        /** Normalizes the project path. */
        public CacheKey {
            Preconditions.requireNonBlank(projectPath,
                    "Project path is required");
            Preconditions.requireNonNull(depth, "Depth is required");
            projectPath = normalize(projectPath);
        }

        /**
         * Creates the key of a run.
         *
         * @param projectPath the project root
         * @param config the run configuration
         * @return the key
         */
        public static CacheKey of(final String projectPath,
                final AnalysisConfig config) {
            return new CacheKey(projectPath, config.includeTests(),
                    config.analysisDepth());
        }

        static String normalize(final String path) {
            return Path.of(path).toAbsolutePath().normalize().toString();
        }
    }

}
