package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.CashflowCategory;
import com.liquiplan.forecast.model.CashflowDirection;
import com.liquiplan.forecast.model.CategoryBreakdownItem;
import com.liquiplan.forecast.model.LiquidityWeek;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Horizon totals per category and direction. Shares are relative to the direction's total; the weekly
 * average covers the weeks in which the category actually occurs.
 */
@Component
public class CategoryBreakdownAggregator {

    private final AccountCategorizer categorizer;

    public CategoryBreakdownAggregator(AccountCategorizer categorizer) {
        this.categorizer = categorizer;
    }

    public List<CategoryBreakdownItem> aggregate(List<LiquidityWeek> weeks) {
        Map<CategoryKey, CategoryTotal> totals = new LinkedHashMap<>();
        for (LiquidityWeek week : weeks) {
            for (CashflowCategory category : week.categories()) {
                totals.computeIfAbsent(new CategoryKey(category.name(), category.direction()), key -> new CategoryTotal())
                        .add(category.amount());
            }
        }

        Map<CashflowDirection, BigDecimal> directionTotals = new EnumMap<>(CashflowDirection.class);
        totals.forEach((key, total) -> directionTotals.merge(key.direction(), total.amount, BigDecimal::add));

        return totals.entrySet().stream()
                .map(entry -> {
                    CategoryKey key = entry.getKey();
                    CategoryTotal total = entry.getValue();
                    BigDecimal directionTotal = directionTotals.getOrDefault(key.direction(), BigDecimal.ZERO);
                    return new CategoryBreakdownItem(
                            key.name(),
                            Money.round(total.amount),
                            key.direction(),
                            Money.divideSafe(total.amount, BigDecimal.valueOf(total.occurrences)),
                            Money.percentageOf(total.amount, directionTotal),
                            categorizer.colorFor(key.name()));
                })
                .sorted(Comparator.comparing(CategoryBreakdownItem::totalAmount).reversed())
                .toList();
    }

    private record CategoryKey(String name, CashflowDirection direction) {
    }

    private static final class CategoryTotal {
        private BigDecimal amount = BigDecimal.ZERO;
        private int occurrences;

        private void add(BigDecimal value) {
            amount = amount.add(value);
            occurrences++;
        }
    }
}
