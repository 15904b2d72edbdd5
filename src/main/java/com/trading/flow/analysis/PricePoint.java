package com.trading.flow.analysis;

import java.time.LocalDate;

/** One daily close. */
public record PricePoint(LocalDate date, double close) {

    @Override
    public String toString() {
        return "(" + date + ", " + close + ")";
    }
}
