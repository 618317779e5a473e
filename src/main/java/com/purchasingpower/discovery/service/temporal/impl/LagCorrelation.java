package com.purchasingpower.discovery.service.temporal.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pearson correlation of two daily series at a given lag.
 *
 * <p>At lag {@code L} the value of {@code x} on day {@code d} is paired with the value of
 * {@code y} on day {@code d + L}; only days present in both series contribute.
 */
final class LagCorrelation {

    record Result(int lag, double coefficient, int overlap) {
    }

    private LagCorrelation() {
    }

    static Optional<Result> atLag(DailySeries x, DailySeries y, int lag, int minOverlap) {
        List<double[]> pairs = new ArrayList<>();
        for (Map.Entry<Long, Double> entry : x.values().entrySet()) {
            Double other = y.valueOn(entry.getKey() + lag);
            if (other != null) {
                pairs.add(new double[]{entry.getValue(), other});
            }
        }
        if (pairs.size() < minOverlap) {
            return Optional.empty();
        }
        double r = pearson(pairs);
        return Double.isNaN(r) ? Optional.empty() : Optional.of(new Result(lag, r, pairs.size()));
    }

    /**
     * Lag in {@code [-window, window]} with the largest |r|. Lags are tried in the order
     * 0, 1, -1, 2, -2... and only a strictly larger |r| replaces the current best, so ties
     * go to the smaller |lag| and then to the positive one.
     */
    static Optional<Result> bestLag(DailySeries x, DailySeries y, int window, int minOverlap) {
        Result best = null;
        for (int step = 0; step <= 2 * window; step++) {
            int lag = (step % 2 == 1) ? (step + 1) / 2 : -(step / 2);
            Optional<Result> candidate = atLag(x, y, lag, minOverlap);
            if (candidate.isPresent()
                    && (best == null || Math.abs(candidate.get().coefficient()) > Math.abs(best.coefficient()))) {
                best = candidate.get();
            }
        }
        return Optional.ofNullable(best);
    }

    static double pearson(List<double[]> pairs) {
        int n = pairs.size();
        double meanX = 0;
        double meanY = 0;
        for (double[] p : pairs) {
            meanX += p[0];
            meanY += p[1];
        }
        meanX /= n;
        meanY /= n;

        double cov = 0;
        double varX = 0;
        double varY = 0;
        for (double[] p : pairs) {
            double dx = p[0] - meanX;
            double dy = p[1] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0 || varY == 0) {
            return Double.NaN;
        }
        double r = cov / Math.sqrt(varX * varY);
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
