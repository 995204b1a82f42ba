package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.DomainException;

/**
 * Raised when a project root or a single file to analyze does not exist
 * or cannot be read. Fatal for the whole run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PathNotFoundException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code carried by this exception. */
    public static final String CODE = "PATH_NOT_FOUND";

    private final String path;

    /**
     * Creates a new exception for the given path.
     *
     * @param thePath the missing or unreadable path
     */
    public PathNotFoundException(final String thePath) {
        super("Path does not exist or is not readable: " + thePath, CODE);
        this.path = thePath;
    }

    /**
     * Creates a new exception for the given path with a cause.
     *
     * @param thePath the missing or unreadable path
     * @param cause the underlying I/O failure
     */
    public PathNotFoundException(final String thePath, final Throwable cause) {
        super("Path does not exist or is not readable: " + thePath, CODE,
                cause);
        this.path = thePath;
    }

    /**
     * Returns the path that could not be found.
     *
     * @return the path as given by the caller
     */
    public String path() {
        return path;
    }

}
