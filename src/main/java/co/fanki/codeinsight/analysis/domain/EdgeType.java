package co.fanki.codeinsight.analysis.domain;

/**
 * Direction a dependency fact was read from.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeType {

    /** The file imports the target module specifier. */
    IMPORT("import"),

    /** The file exports the target name. */
    EXPORT("export");

    private final String label;

    EdgeType(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the lowercase label used in the JSON export.
     *
     * @return "import" or "export"
     */
    public String label() {
        return label;
    }

}
