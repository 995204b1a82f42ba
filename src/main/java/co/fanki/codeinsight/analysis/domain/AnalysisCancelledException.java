package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.DomainException;

/**
 * Raised when a caller cancels a run through its {@link CancellationToken}
 * or the orchestrating thread is interrupted.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalysisCancelledException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code carried by this exception. */
    public static final String CODE = "ANALYSIS_CANCELLED";

    /**
     * Creates a new cancellation exception.
     *
     * @param message what was cancelled
     */
    public AnalysisCancelledException(final String message) {
        super(message, CODE);
    }

    /**
     * Creates a new cancellation exception caused by an interrupt.
     *
     * @param message what was cancelled
     * @param cause the interrupt
     */
    public AnalysisCancelledException(final String message,
            final Throwable cause) {
        super(message, CODE, cause);
    }

}
