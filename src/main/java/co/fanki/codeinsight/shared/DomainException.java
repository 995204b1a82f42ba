package co.fanki.codeinsight.shared;

/**
 * Base exception for errors raised by the analysis pipeline.
 *
 * <p>Carries a stable error code so that callers (an HTTP wrapper, a CLI)
 * can map failures without parsing messages. Per-file problems never
 * surface as domain exceptions; only run-level failures do.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code used when no specific code is given. */
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception with the internal error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, INTERNAL_ERROR);
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
