package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.AccountCategory;

public class RangeTableAccountCategorizer implements AccountCategorizer {

    private static final String DEFAULT_COLOR = "#9ca3af";

    private final AccountCategoryTable table;

    public RangeTableAccountCategorizer(AccountCategoryTable table) {
        this.table = table;
    }

    @Override
    public AccountCategory categorize(int account) {
        for (AccountRange range : table.ranges()) {
            if (range.contains(account)) {
                return range.toCategory();
            }
        }
        return account < table.expenseBoundary() ? table.fallbackRevenue() : table.fallbackExpense();
    }

    @Override
    public String colorFor(String categoryName) {
        if (categoryName == null) {
            return DEFAULT_COLOR;
        }
        return table.ranges().stream()
                .filter(range -> range.name().equals(categoryName))
                .map(AccountRange::color)
                .filter(color -> color != null && !color.isBlank())
                .findFirst()
                .orElseGet(() -> fallbackColor(categoryName));
    }

    private String fallbackColor(String categoryName) {
        if (table.fallbackRevenue().name().equals(categoryName)) {
            return table.fallbackRevenue().color();
        }
        if (table.fallbackExpense().name().equals(categoryName)) {
            return table.fallbackExpense().color();
        }
        return DEFAULT_COLOR;
    }
}
