package com.example.automation.model;

/**
 * 调度频率。
 */
public enum Frequency {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * 是否需要 time 字段（hourly 以外均需要）。
     */
    public boolean requiresTimeOfDay() {
        return this != HOURLY;
    }
}
