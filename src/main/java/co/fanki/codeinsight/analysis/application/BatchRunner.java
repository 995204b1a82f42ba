package co.fanki.codeinsight.analysis.application;

import co.fanki.codeinsight.analysis.domain.AnalysisCancelledException;
import co.fanki.codeinsight.analysis.domain.AnalysisConfig;
import co.fanki.codeinsight.analysis.domain.CancellationToken;
import co.fanki.codeinsight.analysis.domain.FileAnalysis;
import co.fanki.codeinsight.analysis.domain.FileAnalyzer;
import co.fanki.codeinsight.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the {@link FileAnalyzer} over a list of files with bounded
 * concurrency.
 *
 * <p>Files are split into sequential batches of {@code width} files; the
 * files of a batch run concurrently on the analysis worker pool and a
 * short pause separates two batches. A file that fails is logged and
 * dropped, the rest of the run continues. Results come back in the order
 * of the input list.</p>
 *
 * <p>The cancellation token is checked before every batch and while
 * waiting for in-flight files; on cancellation the in-flight files are
 * interrupted and {@link AnalysisCancelledException} is thrown.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class BatchRunner {

    private static final Logger LOG = LoggerFactory.getLogger(
            BatchRunner.class);

    /** How often a waiting batch re-checks the cancellation token. */
    private static final long POLL_MILLIS = 50;

    private final FileAnalyzer fileAnalyzer;
    private final ExecutorService executor;
    private final int width;
    private final Duration pause;

    /**
     * Creates a new BatchRunner.
     *
     * @param theFileAnalyzer the per-file analyzer
     * @param theExecutor the analysis worker pool
     * @param theWidth how many files run concurrently
     * @param thePause the pause between two batches
     */
    public BatchRunner(
            final FileAnalyzer theFileAnalyzer,
            @Qualifier("analysisExecutor") final ExecutorService theExecutor,
            @Value("${code-insight.batch.width:10}") final int theWidth,
            @Value("${code-insight.batch.pause:10ms}")
            final Duration thePause) {
        Preconditions.requireNonNull(theFileAnalyzer,
                "File analyzer is required");
        Preconditions.requireNonNull(theExecutor, "Executor is required");
        Preconditions.requirePositive(theWidth, "Batch width must be positive");
        Preconditions.requireNonNull(thePause, "Pause is required");
        this.fileAnalyzer = theFileAnalyzer;
        this.executor = theExecutor;
        this.width = theWidth;
        this.pause = thePause;
    }

    /**
     * Analyzes every file.
     *
     * @param files the files, in discovery order
     * @param config the run configuration
     * @param listener receives one update per file
     * @param token the cancellation token of the run
     * @return the analyses of the files that did not fail, in input order
     * @throws AnalysisCancelledException if the run is cancelled
     */
    public List<FileAnalysis> run(final List<Path> files,
            final AnalysisConfig config, final ProgressListener listener,
            final CancellationToken token) {
        Preconditions.requireNonNull(files, "Files are required");
        Preconditions.requireNonNull(config, "Config is required");
        Preconditions.requireNonNull(listener, "Listener is required");
        Preconditions.requireNonNull(token, "Token is required");

        final int total = files.size();
        final int batches = (total + width - 1) / width;
        final List<FileAnalysis> results = new ArrayList<>(total);
        int processed = 0;
        int failed = 0;

        for (int i = 0; i < total; i += width) {
            token.throwIfCancelled("batch " + (i / width + 1));

            final List<Path> batch = files.subList(i,
                    Math.min(i + width, total));
            LOG.debug("Analyzing batch {}/{} ({} files)", i / width + 1,
                    batches, batch.size());

            final List<Future<FileAnalysis>> futures = new ArrayList<>(
                    batch.size());
            for (final Path file : batch) {
                futures.add(executor.submit(() -> {
                    token.throwIfCancelled("analyzing " + file);
                    return fileAnalyzer.analyze(file, config, token);
                }));
            }

            for (int j = 0; j < futures.size(); j++) {
                final Path file = batch.get(j);
                final FileAnalysis analysis = await(futures.get(j), futures,
                        file, token);
                if (analysis != null) {
                    results.add(analysis);
                } else {
                    failed++;
                }
                processed++;
                listener.onProgress(percent(processed, total),
                        file.toString());
            }

            if (i + width < total) {
                pause();
            }
        }

        LOG.debug("Analyzed {} files, {} dropped", results.size(), failed);
        return results;
    }

    private FileAnalysis await(final Future<FileAnalysis> future,
            final List<Future<FileAnalysis>> inFlight, final Path file,
            final CancellationToken token) {
        while (true) {
            if (token.isCancelled()) {
                cancelAll(inFlight);
                throw new AnalysisCancelledException(
                        "Cancelled while analyzing " + file);
            }
            try {
                return future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (final TimeoutException e) {
                LOG.trace("Still analyzing {}", file);
            } catch (final ExecutionException e) {
                final Throwable cause = e.getCause();
                if (cause instanceof AnalysisCancelledException) {
                    cancelAll(inFlight);
                    throw (AnalysisCancelledException) cause;
                }
                LOG.warn("Dropping {}: {}", file, cause == null
                        ? e.getMessage() : cause.getMessage());
                return null;
            } catch (final CancellationException e) {
                cancelAll(inFlight);
                throw new AnalysisCancelledException(
                        "Analysis of " + file + " was cancelled", e);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(inFlight);
                throw new AnalysisCancelledException(
                        "Interrupted while analyzing " + file, e);
            }
        }
    }

    private void pause() {
        if (pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException(
                    "Interrupted between batches", e);
        }
    }

    private static void cancelAll(final List<Future<FileAnalysis>> futures) {
        for (final Future<FileAnalysis> future : futures) {
            future.cancel(true);
        }
    }

    private static double percent(final int processed, final int total) {
        return processed == total ? 100.0 : processed * 100.0 / total;
    }

}
