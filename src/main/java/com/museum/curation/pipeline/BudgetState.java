package com.museum.curation.pipeline;

/**
 * Spend ledger for one run. A call may proceed only while
 * {@code spent + estimate <= total * (1 - reserveRatio)}.
 * Not thread-safe; a run is single-threaded.
 */
public class BudgetState {

    private final double total;
    private final double reserveRatio;
    private double spent;

    public BudgetState(double total, double reserveRatio) {
        if (total < 0) {
            throw new IllegalArgumentException("total budget must be >= 0");
        }
        if (reserveRatio < 0.0 || reserveRatio >= 1.0) {
            throw new IllegalArgumentException("reserveRatio must be in [0, 1)");
        }
        this.total = total;
        this.reserveRatio = reserveRatio;
    }

    public boolean canSpend(CostEstimate estimate) {
        return canSpend(estimate.dollars());
    }

    public boolean canSpend(double amount) {
        return spent + amount <= ceiling();
    }

    public void spend(double amount) {
        spent += Math.max(0.0, amount);
    }

    /**
     * Highest total spend allowed before the reserve is touched.
     */
    public double ceiling() {
        return total * (1.0 - reserveRatio);
    }

    public double getTotal() {
        return total;
    }

    public double getReserveRatio() {
        return reserveRatio;
    }

    public double getSpent() {
        return spent;
    }

    public double getRemaining() {
        return Math.max(0.0, total - spent);
    }
}
