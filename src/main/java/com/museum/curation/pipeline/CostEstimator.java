package com.museum.curation.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estimates the dollar cost of model calls from a per-model price table
 * (dollars per million input and output tokens). Prompt size is approximated
 * as one token per four characters. Unpriced models cost nothing.
 */
public class CostEstimator {

    private static final double PER_MILLION = 1_000_000.0;

    private final Map<String, ModelPrice> prices;

    public CostEstimator() {
        this(defaultPrices());
    }

    public CostEstimator(Map<String, ModelPrice> prices) {
        this.prices = Map.copyOf(prices);
    }

    public static Map<String, ModelPrice> defaultPrices() {
        Map<String, ModelPrice> prices = new LinkedHashMap<>();
        prices.put("gpt-4o-mini", new ModelPrice(0.15, 0.60));
        prices.put("gpt-4o", new ModelPrice(2.50, 10.00));
        prices.put("claude-3-haiku-20240307", new ModelPrice(0.25, 1.25));
        prices.put("claude-3-sonnet-20240229", new ModelPrice(3.00, 15.00));
        return prices;
    }

    public static long estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3) / 4;
    }

    public CostEstimate estimate(String model, String prompt, long maxOutputTokens) {
        return estimate(model, estimateTokens(prompt), maxOutputTokens);
    }

    public CostEstimate estimate(String model, long inputTokens, long outputTokens) {
        ModelPrice price = prices.get(model);
        if (price == null) {
            return new CostEstimate(model, inputTokens, outputTokens, 0.0);
        }
        double dollars = inputTokens / PER_MILLION * price.inputPerMillion()
                + outputTokens / PER_MILLION * price.outputPerMillion();
        return new CostEstimate(model, inputTokens, outputTokens, dollars);
    }

    /**
     * Price in dollars per million tokens.
     */
    public record ModelPrice(double inputPerMillion, double outputPerMillion) {
        public ModelPrice {
            if (inputPerMillion < 0 || outputPerMillion < 0) {
                throw new IllegalArgumentException("prices must be >= 0");
            }
        }
    }
}
