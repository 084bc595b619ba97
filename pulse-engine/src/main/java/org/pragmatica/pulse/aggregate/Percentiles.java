package org.pragmatica.pulse.aggregate;

/**
 * Percentile calculation over sorted samples.
 */
public final class Percentiles {
    private Percentiles() {}

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param sorted     Values in ascending order
     * @param percentile Value between 0 and 100 (e.g., 95 for p95)
     * @return 0 for an empty array
     */
    public static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = Math.max(0.0, Math.min(100.0, percentile)) / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
