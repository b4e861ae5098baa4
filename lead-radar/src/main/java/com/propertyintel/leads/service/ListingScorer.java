package com.propertyintel.leads.service;

import com.propertyintel.leads.model.Property;
import com.propertyintel.leads.model.ScoreBreakdown;
import com.propertyintel.leads.model.ScoredProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Computes the 0-100 listing score for a batch of properties.
 *
 * Equity and value gap are min-max scaled against the batch itself, so the
 * same property can score differently depending on what else is in the pool.
 * Missing values are replaced by the batch median before scaling.
 */
@Component
@RequiredArgsConstructor
public class ListingScorer {

    static final long RECENCY_WINDOW_DAYS = 5 * 365;
    static final double NEUTRAL_RECENCY = 0.4;

    private final ScoringWeights weights;
    private final Clock clock;

    public List<ScoredProperty> score(List<Property> properties) {
        Stats equity = Stats.of(properties, Property::getEquityAvailable);
        Stats valueGap = Stats.of(properties, Property::getValueGap);
        LocalDate today = LocalDate.now(clock);

        List<ScoredProperty> scored = new ArrayList<>(properties.size());
        for (Property p : properties) {
            double equityScore = equity.scale(p.getEquityAvailable());
            double valueGapScore = valueGap.scale(p.getValueGap());
            double recencyScore = recencyScore(p.getTransferDate(), today);

            double blended = equityScore * weights.equity()
                    + valueGapScore * weights.valueGap()
                    + recencyScore * weights.recency();

            scored.add(new ScoredProperty(
                    p,
                    clamp(round(blended * 100, 2), 0.0, 100.0),
                    new ScoreBreakdown(round(equityScore, 4), round(valueGapScore, 4), round(recencyScore, 4))));
        }
        return scored;
    }

    /**
     * Linear decay over five years. No date scores a neutral 0.4, a future date
     * scores 1.0.
     */
    static double recencyScore(LocalDate transferDate, LocalDate today) {
        if (transferDate == null) return NEUTRAL_RECENCY;
        long ageDays = ChronoUnit.DAYS.between(transferDate, today);
        if (ageDays < 0) return 1.0;
        if (ageDays >= RECENCY_WINDOW_DAYS) return 0.0;
        return 1.0 - ((double) ageDays / RECENCY_WINDOW_DAYS);
    }

    static double normalise(double value, double min, double max) {
        if (isClose(min, max)) return 1.0;
        return clamp((value - min) / (max - min), 0.0, 1.0);
    }

    private static boolean isClose(double a, double b) {
        return Math.abs(a - b) <= 1e-9 * Math.max(Math.abs(a), Math.abs(b));
    }

    private static double clamp(double value, double lo, double hi) {
        return Math.max(lo, Math.min(hi, value));
    }

    static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }

    // ── Batch statistics ─────────────────────────────────────────────────────

    /** Min, max and median of the present values of one signal. */
    record Stats(double fallback, double min, double max) {

        static Stats of(List<Property> properties, Function<Property, Double> signal) {
            double[] present = properties.stream()
                    .map(signal)
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .sorted()
                    .toArray();
            if (present.length == 0) {
                return new Stats(0.0, 0.0, 0.0);
            }
            return new Stats(median(present), present[0], present[present.length - 1]);
        }

        double scale(Double value) {
            return normalise(value != null ? value : fallback, min, max);
        }

        private static double median(double[] sorted) {
            int mid = sorted.length / 2;
            if (sorted.length % 2 == 1) return sorted[mid];
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
    }
}
