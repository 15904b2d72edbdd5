package com.trading.flow.analysis;

import java.util.Map;
import java.util.TreeMap;

/**
 * Financial statement line items by period, e.g.
 * {@code {"Total Revenue": {"2024-09-30": 3.9E11}}}.
 */
public record Financials(Map<String, Map<String, Double>> lineItems) {

    public Financials {
        lineItems = Map.copyOf(lineItems);
    }

    public static Financials empty() {
        return new Financials(Map.of());
    }

    public boolean isEmpty() {
        return lineItems.isEmpty();
    }

    @Override
    public String toString() {
        return new TreeMap<>(lineItems).toString();
    }
}
