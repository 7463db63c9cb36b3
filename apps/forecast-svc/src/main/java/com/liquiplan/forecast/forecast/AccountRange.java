package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.AccountCategory;
import com.liquiplan.forecast.model.CashflowDirection;

public record AccountRange(String name, int from, int to, CashflowDirection direction, String color) {
    public AccountRange {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("category name must be provided");
        }
        if (from > to) {
            throw new IllegalArgumentException("account range for " + name + " is inverted: " + from + " > " + to);
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction must be provided for " + name);
        }
    }

    public boolean contains(int account) {
        return account >= from && account <= to;
    }

    public AccountCategory toCategory() {
        return new AccountCategory(name, direction, color);
    }
}
