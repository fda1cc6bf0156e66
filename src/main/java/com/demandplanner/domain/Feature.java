package com.demandplanner.domain;

// declaration order is the column order of the feature vector
public enum Feature {
    LAG_1, LAG_2, LAG_3, LAG_4, LAG_8, LAG_12, LAG_52,
    ROLLING_MEAN_4, ROLLING_STD_4,
    ROLLING_MEAN_8, ROLLING_STD_8,
    ROLLING_MEAN_12, ROLLING_STD_12,
    YOY_CHANGE,
    WEEK_OF_YEAR, MONTH, QUARTER, TREND;

    public static final int COUNT = values().length;

    public static Feature lag(int weeks) {
        return valueOf("LAG_" + weeks);
    }

    public static Feature rollingMean(int window) {
        return valueOf("ROLLING_MEAN_" + window);
    }

    public static Feature rollingStd(int window) {
        return valueOf("ROLLING_STD_" + window);
    }

    public boolean isCalendar() {
        return this == WEEK_OF_YEAR || this == MONTH || this == QUARTER || this == TREND;
    }
}
