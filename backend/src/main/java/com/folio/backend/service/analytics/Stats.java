package com.folio.backend.service.analytics;

final class Stats {

    private Stats() {
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    static double sampleVariance(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sum += diff * diff;
        }
        return sum / (values.length - 1);
    }

    static double sampleStdDev(double[] values) {
        return Math.sqrt(sampleVariance(values));
    }

    static double sampleCovariance(double[] left, double[] right) {
        int n = Math.min(left.length, right.length);
        if (n < 2) {
            return 0.0;
        }
        double meanLeft = mean(left);
        double meanRight = mean(right);
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += (left[i] - meanLeft) * (right[i] - meanRight);
        }
        return sum / (n - 1);
    }
}
