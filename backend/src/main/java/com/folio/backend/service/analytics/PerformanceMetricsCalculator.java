package com.folio.backend.service.analytics;

import com.folio.backend.model.MetricValue;
import com.folio.backend.model.ReturnSeries;
import org.springframework.stereotype.Service;

/**
 * Return and risk-adjusted performance figures for a daily return series.
 * Degenerate denominators yield 0 rather than NaN or infinity.
 */
@Service
public class PerformanceMetricsCalculator {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    private static final double ANNUALIZATION = Math.sqrt(TRADING_DAYS_PER_YEAR);

    public double totalReturn(ReturnSeries returns) {
        double growth = 1.0;
        for (double r : returns.values()) {
            growth *= 1.0 + r;
        }
        return growth - 1.0;
    }

    public double annualizedReturn(ReturnSeries returns) {
        return Stats.mean(returns.values()) * TRADING_DAYS_PER_YEAR;
    }

    public double volatility(ReturnSeries returns) {
        return Stats.sampleStdDev(returns.values()) * ANNUALIZATION;
    }

    public double sharpeRatio(ReturnSeries returns) {
        double volatility = volatility(returns);
        return volatility == 0.0 ? 0.0 : annualizedReturn(returns) / volatility;
    }

    public double sortinoRatio(ReturnSeries returns) {
        double sumSquares = 0.0;
        int negatives = 0;
        for (double r : returns.values()) {
            if (r < 0) {
                sumSquares += r * r;
                negatives++;
            }
        }
        if (negatives == 0) {
            return 0.0;
        }
        double downsideDeviation = Math.sqrt(sumSquares / negatives);
        if (downsideDeviation == 0.0) {
            return 0.0;
        }
        return annualizedReturn(returns) / (downsideDeviation * ANNUALIZATION);
    }

    /**
     * Worst peak-to-trough decline of the compounded curve, as a fraction (≤ 0).
     * The curve starts at the first observation, not at a unit baseline.
     */
    public double maxDrawdown(ReturnSeries returns) {
        double growth = 1.0;
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (double r : returns.values()) {
            growth *= 1.0 + r;
            peak = Math.max(peak, growth);
            if (peak > 0) {
                worst = Math.min(worst, (growth - peak) / peak);
            }
        }
        return worst;
    }

    public double calmarRatio(ReturnSeries returns) {
        double drawdown = maxDrawdown(returns);
        return drawdown == 0.0 ? 0.0 : annualizedReturn(returns) / Math.abs(drawdown);
    }

    /**
     * Sensitivity to the benchmark over the dates both series share.
     */
    public double beta(ReturnSeries returns, ReturnSeries benchmark) {
        ReturnSeries.Aligned aligned = returns.alignWith(benchmark);
        if (aligned.size() < 2) {
            return 0.0;
        }
        double benchmarkVariance = Stats.sampleVariance(aligned.right());
        if (benchmarkVariance == 0.0) {
            return 0.0;
        }
        return Stats.sampleCovariance(aligned.left(), aligned.right()) / benchmarkVariance;
    }

    /**
     * CAPM excess return over the annualized portfolio return.
     */
    public double alpha(double annualizedReturn, double beta, double riskFreeRate, double marketReturn) {
        return annualizedReturn - (riskFreeRate + beta * (marketReturn - riskFreeRate));
    }

    public Result calculate(ReturnSeries returns, ReturnSeries benchmark, Assumptions assumptions) {
        double annualized = annualizedReturn(returns);
        MetricValue beta = MetricValue.unavailable();
        MetricValue alpha = MetricValue.unavailable();
        if (benchmark != null) {
            double betaValue = beta(returns, benchmark);
            beta = MetricValue.computed(betaValue);
            alpha = MetricValue.computed(alpha(annualized, betaValue,
                    assumptions.riskFreeRate(), assumptions.marketReturn()));
        }
        return new Result(
                totalReturn(returns),
                annualized,
                volatility(returns),
                sharpeRatio(returns),
                sortinoRatio(returns),
                calmarRatio(returns),
                maxDrawdown(returns),
                beta,
                alpha
        );
    }

    public record Assumptions(double riskFreeRate, double marketReturn) {}

    public record Result(
            double totalReturn,
            double annualizedReturn,
            double volatility,
            double sharpeRatio,
            double sortinoRatio,
            double calmarRatio,
            double maxDrawdown,
            MetricValue beta,
            MetricValue alpha
    ) {}
}
