package com.folio.backend.model;

public record MetricValue(double value, MetricStatus status) {

    public static MetricValue computed(double value) {
        return new MetricValue(value, MetricStatus.COMPUTED);
    }

    public static MetricValue unavailable() {
        return new MetricValue(0.0, MetricStatus.UNAVAILABLE);
    }

    public boolean isComputed() {
        return status == MetricStatus.COMPUTED;
    }
}
