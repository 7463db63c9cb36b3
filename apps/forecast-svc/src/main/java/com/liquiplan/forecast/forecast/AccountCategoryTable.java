package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.AccountCategory;
import com.liquiplan.forecast.model.CashflowDirection;
import java.util.List;

/**
 * Ordered account-number ranges; the first range containing an account wins. Accounts outside every
 * range fall back to revenue below {@code expenseBoundary} and to expense at or above it.
 */
public record AccountCategoryTable(
        List<AccountRange> ranges,
        int expenseBoundary,
        AccountCategory fallbackRevenue,
        AccountCategory fallbackExpense
) {
    public static final int DEFAULT_EXPENSE_BOUNDARY = 5000;

    private static final List<AccountRange> DEFAULT_RANGES = List.of(
            new AccountRange("Erlöse", 8000, 8999, CashflowDirection.INFLOW, "#10b981"),
            new AccountRange("Personalkosten", 5000, 5999, CashflowDirection.OUTFLOW, "#ef4444"),
            new AccountRange("Materialkosten", 3000, 3999, CashflowDirection.OUTFLOW, "#f59e0b"),
            new AccountRange("Energie", 4240, 4249, CashflowDirection.OUTFLOW, "#06b6d4"),
            new AccountRange("Raumkosten", 4200, 4299, CashflowDirection.OUTFLOW, "#8b5cf6"),
            new AccountRange("Versicherungen", 4300, 4399, CashflowDirection.OUTFLOW, "#ec4899"),
            new AccountRange("Abschreibungen", 4800, 4899, CashflowDirection.OUTFLOW, "#6b7280"),
            new AccountRange("Sonstige Aufwendungen", 6000, 6999, CashflowDirection.OUTFLOW, "#a855f7"),
            new AccountRange("Steuern", 7000, 7999, CashflowDirection.OUTFLOW, "#dc2626")
    );

    public AccountCategoryTable {
        if (ranges == null) {
            throw new IllegalArgumentException("ranges must be provided");
        }
        if (fallbackRevenue == null || fallbackExpense == null) {
            throw new IllegalArgumentException("fallback categories must be provided");
        }
        ranges = List.copyOf(ranges);
    }

    public static AccountCategoryTable defaults() {
        return withRanges(DEFAULT_RANGES, DEFAULT_EXPENSE_BOUNDARY);
    }

    public static AccountCategoryTable withRanges(List<AccountRange> ranges, int expenseBoundary) {
        return new AccountCategoryTable(
                ranges,
                expenseBoundary,
                new AccountCategory("Sonstige Erlöse", CashflowDirection.INFLOW, "#34d399"),
                new AccountCategory("Sonstige Aufwendungen", CashflowDirection.OUTFLOW, "#9ca3af")
        );
    }
}
