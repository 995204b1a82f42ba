package co.fanki.codeinsight.analysis.domain;

/**
 * Kind of an inline annotation comment.
 *
 * <p>Each kind carries the weight it adds to the technical-debt index.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TodoType {

    /** Pending work. */
    TODO(2.0),

    /** Known defect. */
    FIXME(3.0),

    /** Deliberate shortcut. */
    HACK(1.0),

    /** Informational remark. */
    NOTE(0.5);

    private final double debtWeight;

    TodoType(final double theDebtWeight) {
        this.debtWeight = theDebtWeight;
    }

    /**
     * Returns how much one annotation of this kind adds to the debt score.
     *
     * @return the debt weight
     */
    public double debtWeight() {
        return debtWeight;
    }

    /**
     * Parses a marker as written in source, case-insensitively.
     *
     * @param marker the marker text, e.g. "todo" or "FIXME"
     * @return the matching type
     * @throws IllegalArgumentException if the marker is not recognized
     */
    public static TodoType fromMarker(final String marker) {
        if (marker == null) {
            throw new IllegalArgumentException("Marker is required");
        }
        return valueOf(marker.trim().toUpperCase());
    }

}
