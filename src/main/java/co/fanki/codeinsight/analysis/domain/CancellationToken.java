package co.fanki.codeinsight.analysis.domain;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag threaded through discovery, the batch
 * runner and every file read.
 *
 * <p>Cancelling stops new batches from being dispatched; in-flight files
 * are interrupted by the batch runner and observe the flag before they
 * read their content.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();

    private final boolean cancellable;

    private CancellationToken(final boolean isCancellable) {
        this.cancellable = isCancellable;
    }

    /**
     * Creates a new token that can be cancelled.
     *
     * @return a fresh, not yet cancelled token
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Returns a shared token that never reports cancellation.
     *
     * @return the no-op token
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation. Has no effect on the {@link #none()} token.
     */
    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    /**
     * Checks whether cancellation was requested.
     *
     * @return true once {@link #cancel()} was called
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Throws if cancellation was requested or the current thread was
     * interrupted.
     *
     * @param what a short description of the interrupted work, for the
     *     exception message
     * @throws AnalysisCancelledException if cancelled
     */
    public void throwIfCancelled(final String what) {
        if (isCancelled()) {
            throw new AnalysisCancelledException("Cancelled: " + what);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new AnalysisCancelledException("Interrupted: " + what);
        }
    }

}
