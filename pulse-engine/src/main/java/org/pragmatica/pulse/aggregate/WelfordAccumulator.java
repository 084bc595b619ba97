package org.pragmatica.pulse.aggregate;

/**
 * Running mean and variance using Welford's algorithm.
 * <p>
 * Avoids the catastrophic cancellation of the sum-of-squares formula when values are large relative to their
 * spread.
 */
public final class WelfordAccumulator {
    private long count = 0;
    private double mean = 0.0;

    // Sum of squared differences from the current mean
    private double m2 = 0.0;

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        double delta2 = value - mean;
        m2 += delta * delta2;
    }

    public long count() {
        return count;
    }

    public double mean() {
        return count > 0
               ? mean
               : 0.0;
    }

    /**
     * Population variance (divides by n). Zero for fewer than two values.
     */
    public double variance() {
        return count > 1
               ? Math.max(0.0, m2 / count)
               : 0.0;
    }

    /**
     * Sample variance (divides by n - 1). Zero for fewer than two values.
     */
    public double sampleVariance() {
        return count > 1
               ? Math.max(0.0, m2 / (count - 1))
               : 0.0;
    }

    public double stddev() {
        return Math.sqrt(variance());
    }
}
