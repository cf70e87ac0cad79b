package com.folio.backend.service.analytics;

import com.folio.backend.exception.NoOverlapException;
import com.folio.backend.model.PriceBar;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Relative price of one instrument in units of another, with a trailing
 * simple moving average.
 */
@Service
public class TradeRatioCalculator {

    public Result calculate(List<PriceBar> barsA, List<PriceBar> barsB, int movingAverageWindow) {
        if (movingAverageWindow < 1) {
            throw new IllegalArgumentException("movingAverageWindow must be positive");
        }
        Map<LocalDate, Double> closesA = closesByDate(barsA);
        Map<LocalDate, Double> closesB = closesByDate(barsB);

        List<LocalDate> dates = new ArrayList<>();
        List<Double> ratios = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> entry : closesA.entrySet()) {
            Double closeB = closesB.get(entry.getKey());
            if (closeB == null || closeB == 0.0) {
                continue;
            }
            dates.add(entry.getKey());
            ratios.add(entry.getValue() / closeB);
        }
        if (dates.isEmpty()) {
            throw new NoOverlapException("Price histories share no trading dates");
        }

        List<Point> points = new ArrayList<>(dates.size());
        double windowSum = 0.0;
        for (int i = 0; i < ratios.size(); i++) {
            windowSum += ratios.get(i);
            if (i >= movingAverageWindow) {
                windowSum -= ratios.get(i - movingAverageWindow);
            }
            Double average = i >= movingAverageWindow - 1 ? windowSum / movingAverageWindow : null;
            points.add(new Point(dates.get(i), ratios.get(i), average));
        }

        double[] values = ratios.stream().mapToDouble(Double::doubleValue).toArray();
        double mean = Stats.mean(values);
        double stdDev = Stats.sampleStdDev(values);
        double current = values[values.length - 1];
        double zScore = stdDev == 0.0 ? 0.0 : (current - mean) / stdDev;
        return new Result(List.copyOf(points), current, mean, stdDev, zScore);
    }

    private Map<LocalDate, Double> closesByDate(List<PriceBar> bars) {
        TreeMap<LocalDate, Double> closes = new TreeMap<>();
        if (bars != null) {
            bars.forEach(bar -> closes.put(bar.getDate(), bar.getClose()));
        }
        return closes;
    }

    public record Point(LocalDate date, double ratio, Double movingAverage) {}

    public record Result(
            List<Point> points,
            double currentRatio,
            double mean,
            double standardDeviation,
            double zScore
    ) {}
}
