package com.folio.backend.service.analytics;

import com.folio.backend.model.ReturnSeries;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Tail-risk and benchmark-tracking measures over a daily return series.
 */
@Service
public class RiskMetricsCalculator {

    /**
     * Historical VaR: the (1 - confidence) percentile of the returns, linearly
     * interpolated between order statistics. Reported as a return, so losses
     * are negative.
     */
    public double valueAtRisk(ReturnSeries returns, double confidence) {
        double[] sorted = sorted(returns);
        if (sorted.length == 0) {
            return 0.0;
        }
        return percentile(sorted, 1.0 - confidence);
    }

    /**
     * Mean of every return at or below the VaR cutoff.
     */
    public double conditionalValueAtRisk(ReturnSeries returns, double confidence) {
        double[] sorted = sorted(returns);
        if (sorted.length == 0) {
            return 0.0;
        }
        double cutoff = percentile(sorted, 1.0 - confidence);
        double sum = 0.0;
        int count = 0;
        for (double value : sorted) {
            if (value > cutoff) {
                break;
            }
            sum += value;
            count++;
        }
        return count == 0 ? cutoff : sum / count;
    }

    /**
     * Annualized standard deviation of the active return against the
     * benchmark, over the dates both series share.
     */
    public double trackingError(ReturnSeries returns, ReturnSeries benchmark) {
        ReturnSeries.Aligned aligned = returns.alignWith(benchmark);
        double[] active = new double[aligned.size()];
        for (int i = 0; i < active.length; i++) {
            active[i] = aligned.left()[i] - aligned.right()[i];
        }
        return Stats.sampleStdDev(active) * Math.sqrt(PerformanceMetricsCalculator.TRADING_DAYS_PER_YEAR);
    }

    static double percentile(double[] sorted, double fraction) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double weight = rank - lower;
        return sorted[lower] + weight * (sorted[upper] - sorted[lower]);
    }

    private double[] sorted(ReturnSeries returns) {
        double[] values = returns.values();
        Arrays.sort(values);
        return values;
    }
}
