package com.folio.backend.service.analytics;

import com.folio.backend.model.PriceBar;
import com.folio.backend.model.ReturnSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns close prices into daily returns and combines weighted constituents
 * into a single portfolio return series.
 */
@Slf4j
@Service
public class ReturnsAggregator {

    /**
     * Daily returns of one instrument on its own calendar. The first bar has
     * no return, and a bar following a zero close is skipped.
     */
    public ReturnSeries toReturns(List<PriceBar> bars) {
        if (bars == null || bars.size() < 2) {
            return ReturnSeries.empty();
        }
        List<PriceBar> ordered = bars.stream()
                .sorted(Comparator.comparing(PriceBar::getDate))
                .toList();
        TreeMap<LocalDate, Double> returns = new TreeMap<>();
        for (int i = 1; i < ordered.size(); i++) {
            double previous = ordered.get(i - 1).getClose();
            if (previous == 0.0) {
                continue;
            }
            double current = ordered.get(i).getClose();
            returns.put(ordered.get(i).getDate(), (current - previous) / previous);
        }
        return ReturnSeries.of(returns);
    }

    /**
     * Weighted sum of constituent returns over the union of their dates. A
     * constituent without a return on a given date contributes 0 there.
     *
     * @param constituents ticker to price history
     * @param weights      ticker to allocation weight; tickers without a weight are ignored
     * @return the aggregate series, empty when no constituent has usable history
     */
    public ReturnSeries aggregate(Map<String, List<PriceBar>> constituents, Map<String, Double> weights) {
        TreeMap<LocalDate, Double> combined = new TreeMap<>();
        for (Map.Entry<String, List<PriceBar>> entry : constituents.entrySet()) {
            Double weight = weights.get(entry.getKey());
            if (weight == null) {
                log.debug("No weight for {}, excluded from aggregate", entry.getKey());
                continue;
            }
            ReturnSeries series = toReturns(entry.getValue());
            series.points().forEach(point ->
                    combined.merge(point.date(), weight * point.value(), Double::sum));
        }
        return ReturnSeries.of(combined);
    }

    /**
     * Compounded growth of one unit from the first observation: cum_t = Π(1 + r).
     */
    public ReturnSeries cumulative(ReturnSeries returns) {
        TreeMap<LocalDate, Double> curve = new TreeMap<>();
        double growth = 1.0;
        for (var point : returns.points()) {
            growth *= 1.0 + point.value();
            curve.put(point.date(), growth);
        }
        return ReturnSeries.of(curve);
    }
}
