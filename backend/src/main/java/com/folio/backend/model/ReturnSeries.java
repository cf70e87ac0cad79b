package com.folio.backend.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, date-ordered sequence of fractional daily returns.
 */
public final class ReturnSeries {

    private static final ReturnSeries EMPTY = new ReturnSeries(new TreeMap<>());

    private final NavigableMap<LocalDate, Double> values;

    private ReturnSeries(NavigableMap<LocalDate, Double> values) {
        this.values = Collections.unmodifiableNavigableMap(values);
    }

    public static ReturnSeries empty() {
        return EMPTY;
    }

    public static ReturnSeries of(SortedMap<LocalDate, Double> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ReturnSeries(new TreeMap<>(values));
    }

    public static ReturnSeries of(List<ReturnPoint> points) {
        TreeMap<LocalDate, Double> map = new TreeMap<>();
        if (points != null) {
            points.forEach(point -> map.put(point.date(), point.value()));
        }
        return of(map);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public List<LocalDate> dates() {
        return List.copyOf(values.keySet());
    }

    public double[] values() {
        return values.values().stream().mapToDouble(Double::doubleValue).toArray();
    }

    public Optional<Double> valueAt(LocalDate date) {
        return Optional.ofNullable(values.get(date));
    }

    public Optional<LocalDate> firstDate() {
        return isEmpty() ? Optional.empty() : Optional.of(values.firstKey());
    }

    public Optional<LocalDate> lastDate() {
        return isEmpty() ? Optional.empty() : Optional.of(values.lastKey());
    }

    public List<ReturnPoint> points() {
        List<ReturnPoint> points = new ArrayList<>(values.size());
        for (Map.Entry<LocalDate, Double> entry : values.entrySet()) {
            points.add(new ReturnPoint(entry.getKey(), entry.getValue()));
        }
        return points;
    }

    /**
     * Pairs this series with another over the dates both of them carry.
     */
    public Aligned alignWith(ReturnSeries other) {
        List<LocalDate> shared = new ArrayList<>();
        for (LocalDate date : values.keySet()) {
            if (other.values.containsKey(date)) {
                shared.add(date);
            }
        }
        double[] left = new double[shared.size()];
        double[] right = new double[shared.size()];
        for (int i = 0; i < shared.size(); i++) {
            left[i] = values.get(shared.get(i));
            right[i] = other.values.get(shared.get(i));
        }
        return new Aligned(List.copyOf(shared), left, right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReturnSeries that)) {
            return false;
        }
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ReturnSeries{size=" + values.size() + "}";
    }

    public record Aligned(List<LocalDate> dates, double[] left, double[] right) {
        public int size() {
            return dates.size();
        }
    }
}
