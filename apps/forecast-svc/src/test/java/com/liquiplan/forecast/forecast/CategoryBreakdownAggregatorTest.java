package com.liquiplan.forecast.forecast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.liquiplan.forecast.model.CashflowCategory;
import com.liquiplan.forecast.model.CashflowDirection;
import com.liquiplan.forecast.model.CategoryBreakdownItem;
import com.liquiplan.forecast.model.LiquidityWeek;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class CategoryBreakdownAggregatorTest {

    private final CategoryBreakdownAggregator aggregator = new CategoryBreakdownAggregator(ForecastFixtures.categorizer());

    @Test
    void sumsAcrossWeeksAndSharesWithinDirection() {
        List<CategoryBreakdownItem> breakdown = aggregator.aggregate(List.of(
                week(0, category("Personalkosten", "3000.00", CashflowDirection.OUTFLOW),
                        category("Erlöse", "6000.00", CashflowDirection.INFLOW)),
                week(1, category("Personalkosten", "1000.00", CashflowDirection.OUTFLOW),
                        category("Raumkosten", "1000.00", CashflowDirection.OUTFLOW))
        ));

        assertThat(breakdown).extracting(CategoryBreakdownItem::name)
                .containsExactly("Erlöse", "Personalkosten", "Raumkosten");
        CategoryBreakdownItem payroll = breakdown.get(1);
        assertThat(payroll.totalAmount()).isEqualByComparingTo("4000.00");
        assertThat(payroll.weeklyAverage()).isEqualByComparingTo("2000.00");
        assertThat(payroll.percentage()).isEqualByComparingTo("80.00");
        assertThat(payroll.color()).isEqualTo("#ef4444");
        assertThat(breakdown.get(0).percentage()).isEqualByComparingTo("100.00");
        assertThat(breakdown.get(0).weeklyAverage()).isEqualByComparingTo("6000.00");
        assertThat(breakdown.get(2).percentage()).isEqualByComparingTo("20.00");
        assertThat(breakdown.get(2).weeklyAverage()).isEqualByComparingTo("1000.00");
    }

    @Test
    void weeklyAverageCoversWeeksWhereCategoryOccurs() {
        List<CategoryBreakdownItem> breakdown = aggregator.aggregate(List.of(
                week(0, category("Raumkosten", "1500.00", CashflowDirection.OUTFLOW)),
                week(1),
                week(2),
                week(3)
        ));

        assertThat(breakdown).hasSize(1);
        assertThat(breakdown.get(0).weeklyAverage()).isEqualByComparingTo("1500.00");
    }

    @Test
    void sameCategoryInBothDirectionsStaysSeparate() {
        List<CategoryBreakdownItem> breakdown = aggregator.aggregate(List.of(
                week(0, category("Personalkosten", "200.00", CashflowDirection.INFLOW),
                        category("Personalkosten", "5000.00", CashflowDirection.OUTFLOW)),
                week(1, category("Erlöse", "800.00", CashflowDirection.INFLOW))
        ));

        assertThat(breakdown).extracting(CategoryBreakdownItem::name, CategoryBreakdownItem::direction)
                .containsExactly(
                        tuple("Personalkosten", CashflowDirection.OUTFLOW),
                        tuple("Erlöse", CashflowDirection.INFLOW),
                        tuple("Personalkosten", CashflowDirection.INFLOW));
        assertThat(breakdown.get(0).totalAmount()).isEqualByComparingTo("5000.00");
        assertThat(breakdown.get(0).percentage()).isEqualByComparingTo("100.00");
        assertThat(breakdown.get(2).percentage()).isEqualByComparingTo("20.00");
    }

    @Test
    void noCategoriesYieldsEmptyBreakdown() {
        assertThat(aggregator.aggregate(List.of(week(0)))).isEmpty();
        assertThat(aggregator.aggregate(List.of())).isEmpty();
    }

    private static CashflowCategory category(String name, String amount, CashflowDirection direction) {
        return new CashflowCategory(name, new BigDecimal(amount), direction, false, BigDecimal.ZERO, 0, 0);
    }

    private static LiquidityWeek week(int index, CashflowCategory... categories) {
        LocalDate start = LocalDate.of(2024, 3, 4).plusWeeks(index);
        return new LiquidityWeek(index, 10 + index, start, start.plusDays(6), BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ZERO,
                List.of(categories));
    }
}
