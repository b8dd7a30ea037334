package com.sprintreport.domain.model;

import java.util.Arrays;

/**
 * Look-back windows accepted by the commit trend endpoint.
 */
public enum TrendPeriod {

    ONE_MONTH("1month", 1),
    THREE_MONTHS("3months", 3),
    SIX_MONTHS("6months", 6),
    ONE_YEAR("1year", 12);

    private final String value;
    private final int months;

    TrendPeriod(String value, int months) {
        this.value = value;
        this.months = months;
    }

    public String getValue() {
        return value;
    }

    public int getMonths() {
        return months;
    }

    public static TrendPeriod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SIX_MONTHS;
        }
        return Arrays.stream(values())
                .filter(period -> period.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown period: " + value));
    }
}
