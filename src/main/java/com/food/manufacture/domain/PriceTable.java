package com.food.manufacture.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Forecast purchase price per ton, keyed by oil id and period.
 */
@ToString
@EqualsAndHashCode
public final class PriceTable {

    private final Map<String, NavigableMap<Integer, Double>> prices;

    private PriceTable(Map<String, NavigableMap<Integer, Double>> prices) {
        this.prices = prices;
    }

    public OptionalDouble find(String oilId, int period) {
        NavigableMap<Integer, Double> series = prices.get(oilId);
        if (series == null || !series.containsKey(period)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(series.get(period));
    }

    public double priceOf(String oilId, int period) {
        OptionalDouble price = find(oilId, period);
        if (price.isEmpty()) {
            throw new ValidationException("No purchase price for " + oilId + " in period " + period);
        }
        return price.getAsDouble();
    }

    /**
     * Every period that carries at least one price, ascending.
     */
    public SortedSet<Integer> periods() {
        SortedSet<Integer> periods = new TreeSet<>();
        prices.values().forEach(series -> periods.addAll(series.keySet()));
        return Collections.unmodifiableSortedSet(periods);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, NavigableMap<Integer, Double>> prices = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder price(String oilId, int period, double price) {
            prices.computeIfAbsent(oilId, id -> new TreeMap<>()).put(period, price);
            return this;
        }

        /**
         * Adds one price per period, the first value going to period 1.
         */
        public Builder series(String oilId, double... pricesFromFirstPeriod) {
            for (int i = 0; i < pricesFromFirstPeriod.length; i++) {
                price(oilId, i + 1, pricesFromFirstPeriod[i]);
            }
            return this;
        }

        public PriceTable build() {
            Map<String, NavigableMap<Integer, Double>> copy = new LinkedHashMap<>();
            prices.forEach((oil, series) -> copy.put(oil, Collections.unmodifiableNavigableMap(new TreeMap<>(series))));
            return new PriceTable(Collections.unmodifiableMap(copy));
        }
    }
}
