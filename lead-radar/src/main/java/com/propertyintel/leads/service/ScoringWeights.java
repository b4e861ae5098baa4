package com.propertyintel.leads.service;

/**
 * Listing score weights, normalised to sum to 1.
 */
public record ScoringWeights(double equity, double valueGap, double recency) {

    /**
     * Floor each weight at zero, divide by the total and round to 4 decimals.
     * When nothing is positive the divisor falls back to 1.0, leaving every weight at zero.
     */
    public static ScoringWeights normalise(double equity, double valueGap, double recency) {
        double e = Math.max(equity, 0.0);
        double v = Math.max(valueGap, 0.0);
        double r = Math.max(recency, 0.0);
        double total = e + v + r;
        if (total <= 0.0) {
            total = 1.0;
        }
        return new ScoringWeights(
                ListingScorer.round(e / total, 4),
                ListingScorer.round(v / total, 4),
                ListingScorer.round(r / total, 4));
    }
}
