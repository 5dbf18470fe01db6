package io.aim.metrics;

/// Streaming mean and population standard deviation (Welford).
final class RunningStatistics {

    private long count;
    private double mean;
    private double m2;

    void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    long count() {
        return count;
    }

    double mean() {
        return mean;
    }

    /// @return population standard deviation, `0` for fewer than two values
    double standardDeviation() {
        return count < 2 ? 0.0 : Math.sqrt(m2 / count);
    }
}
