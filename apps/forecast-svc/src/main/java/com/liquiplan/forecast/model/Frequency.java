package com.liquiplan.forecast.model;

public enum Frequency {
    WEEKLY,
    BIWEEKLY,
    MONTHLY,
    QUARTERLY
}
