package com.folio.backend.service.analytics;

import com.folio.backend.model.ReturnSeries;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class CorrelationService {

    /**
     * Pearson correlation of two return series over the dates they share.
     * Returns 0 with fewer than two shared dates or when either side has no
     * variance.
     */
    public double correlation(ReturnSeries first, ReturnSeries second) {
        ReturnSeries.Aligned aligned = first.alignWith(second);
        if (aligned.size() < 2) {
            return 0.0;
        }
        double[] left = aligned.left();
        double[] right = aligned.right();
        double meanLeft = Stats.mean(left);
        double meanRight = Stats.mean(right);

        double covariance = 0;
        double varianceLeft = 0;
        double varianceRight = 0;
        for (int i = 0; i < left.length; i++) {
            double diffLeft = left[i] - meanLeft;
            double diffRight = right[i] - meanRight;
            covariance += diffLeft * diffRight;
            varianceLeft += diffLeft * diffLeft;
            varianceRight += diffRight * diffRight;
        }
        if (varianceLeft == 0 || varianceRight == 0) {
            return 0.0;
        }
        return covariance / Math.sqrt(varianceLeft * varianceRight);
    }

    /**
     * Square matrix over the given series in iteration order, with 1 on the
     * diagonal.
     */
    public Matrix buildMatrix(Map<String, ReturnSeries> seriesByLabel) {
        Map<String, ReturnSeries> ordered = new LinkedHashMap<>(seriesByLabel);
        List<String> labels = new ArrayList<>(ordered.keySet());
        int size = labels.size();
        double[][] values = new double[size][size];
        for (int i = 0; i < size; i++) {
            values[i][i] = 1.0;
            for (int j = i + 1; j < size; j++) {
                double correlation = correlation(ordered.get(labels.get(i)), ordered.get(labels.get(j)));
                values[i][j] = correlation;
                values[j][i] = correlation;
            }
        }
        return new Matrix(List.copyOf(labels), values);
    }

    public record Matrix(List<String> labels, double[][] values) {

        public double get(String row, String column) {
            return values[labels.indexOf(row)][labels.indexOf(column)];
        }
    }
}
