package appraiser.core.port.out;

/**
 * A trained regression model over encoded feature vectors.
 */
public interface RegressionModel {

    /**
     * Number of columns every input vector must have.
     */
    int featureCount();

    /**
     * Estimate the target for one encoded row.
     *
     * @param features encoded row of length {@link #featureCount()}
     * @return the estimate
     * @throws IllegalArgumentException if the row has the wrong width
     */
    double predict(double[] features);

    /**
     * Estimate the target for several rows.
     *
     * @param rows encoded rows
     * @return one estimate per row, in order
     */
    default double[] predictAll(double[][] rows) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = predict(rows[i]);
        }
        return out;
    }
}
