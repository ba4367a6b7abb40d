package com.museum.curation.pipeline;

/**
 * Estimated cost of one paid source call.
 *
 * @param model        priced model name, or null for unpaid calls
 * @param inputTokens  estimated prompt tokens
 * @param outputTokens expected completion tokens
 * @param dollars      estimated spend
 */
public record CostEstimate(String model, long inputTokens, long outputTokens, double dollars) {

    private static final CostEstimate FREE = new CostEstimate(null, 0, 0, 0.0);

    public CostEstimate {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("token counts must be >= 0");
        }
        if (dollars < 0 || Double.isNaN(dollars)) {
            throw new IllegalArgumentException("dollars must be >= 0");
        }
    }

    public static CostEstimate free() {
        return FREE;
    }

    public static CostEstimate ofDollars(double dollars) {
        return new CostEstimate(null, 0, 0, dollars);
    }

    public boolean isFree() {
        return dollars == 0.0;
    }
}
