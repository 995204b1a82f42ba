package co.fanki.codeinsight.analysis.domain;

/**
 * Number of files per size bucket, by non-blank line count.
 *
 * @param small files under 100 lines
 * @param medium files from 100 to 499 lines
 * @param large files from 500 to 999 lines
 * @param huge files with 1000 lines or more
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SizeDistribution(int small, int medium, int large, int huge) {

    /**
     * Returns the total number of files counted.
     *
     * @return the sum of all buckets
     */
    public int total() {
        return small + medium + large + huge;
    }

}
