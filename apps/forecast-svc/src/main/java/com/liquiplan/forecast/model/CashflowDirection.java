package com.liquiplan.forecast.model;

public enum CashflowDirection {
    INFLOW,
    OUTFLOW;

    public CashflowDirection opposite() {
        return this == INFLOW ? OUTFLOW : INFLOW;
    }
}
