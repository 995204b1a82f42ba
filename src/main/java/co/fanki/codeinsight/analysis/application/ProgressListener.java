package co.fanki.codeinsight.analysis.application;

/**
 * Receives progress updates of a running analysis.
 *
 * <p>Called on the orchestrating thread, in submission order. Percentages
 * never decrease and the last update of a completed run is exactly
 * 100.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface ProgressListener {

    /** Listener that ignores every update. */
    ProgressListener NONE = (percent, currentFile) -> { };

    /**
     * Called after a unit of work completes.
     *
     * @param percent the completed percentage, between 0 and 100
     * @param currentFile the file just processed, or a status message
     */
    void onProgress(double percent, String currentFile);

}
