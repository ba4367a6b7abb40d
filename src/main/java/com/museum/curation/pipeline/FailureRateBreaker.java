package com.museum.curation.pipeline;

/**
 * Trips once {@code failed / processed} exceeds the threshold. Processed counts
 * every record a stage attempted in this run, failed or not.
 */
public class FailureRateBreaker {

    private final double threshold;
    private int processed;
    private int failed;

    public FailureRateBreaker(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1]");
        }
        this.threshold = threshold;
    }

    public void recordSuccess() {
        processed++;
    }

    public void recordFailure() {
        processed++;
        failed++;
    }

    public double failureRate() {
        return processed == 0 ? 0.0 : (double) failed / processed;
    }

    public boolean isTripped() {
        return failureRate() > threshold;
    }

    public int getProcessed() {
        return processed;
    }

    public int getFailed() {
        return failed;
    }

    public double getThreshold() {
        return threshold;
    }
}
