package com.trading.flow.analysis;

import java.util.List;

/**
 * Daily closing prices, oldest first.
 */
public record PriceHistory(List<PricePoint> points) {

    public PriceHistory {
        points = List.copyOf(points);
    }

    public static PriceHistory empty() {
        return new PriceHistory(List.of());
    }

    /** The most recent {@code n} points, or all of them if there are fewer. */
    public List<PricePoint> last(int n) {
        int size = points.size();
        return n >= size ? points : points.subList(size - n, size);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
