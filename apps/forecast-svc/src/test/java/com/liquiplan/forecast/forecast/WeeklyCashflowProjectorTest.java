package com.liquiplan.forecast.forecast;

import static com.liquiplan.forecast.forecast.ForecastFixtures.booking;
import static org.assertj.core.api.Assertions.assertThat;

import com.liquiplan.forecast.model.Booking;
import com.liquiplan.forecast.model.CashflowCategory;
import com.liquiplan.forecast.model.CashflowDirection;
import com.liquiplan.forecast.model.CategoryBreakdownItem;
import com.liquiplan.forecast.model.Frequency;
import com.liquiplan.forecast.model.LiquidityAlert;
import com.liquiplan.forecast.model.LiquidityForecast;
import com.liquiplan.forecast.model.LiquidityWeek;
import com.liquiplan.forecast.model.RecurringPattern;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WeeklyCashflowProjectorTest {

    private static final LocalDate NOW = LocalDate.of(2024, 3, 4);

    private WeeklyCashflowProjector projector;

    @BeforeEach
    void setUp() {
        projector = ForecastFixtures.projector(ForecastSettings.defaults());
    }

    @Test
    void emptyHistoryKeepsBalanceFlatWithFallbackBand() {
        LiquidityForecast forecast = projector.project(List.of(), parameters("100000", "50000", 4));

        assertThat(forecast.weeks()).hasSize(4);
        assertThat(forecast.weeks()).allSatisfy(week -> {
            assertThat(week.inflow()).isEqualByComparingTo("0.00");
            assertThat(week.outflow()).isEqualByComparingTo("0.00");
            assertThat(week.closingBalance()).isEqualByComparingTo("100000.00");
            assertThat(week.categories()).isEmpty();
        });
        assertThat(forecast.weeks().get(0).lowerBound()).isEqualByComparingTo("95000.00");
        assertThat(forecast.weeks().get(0).upperBound()).isEqualByComparingTo("105000.00");
        assertThat(forecast.weeks().get(1).lowerBound()).isEqualByComparingTo("94500.00");
        assertThat(forecast.alerts()).isEmpty();
        assertThat(forecast.recurringPatterns()).isEmpty();
        assertThat(forecast.kpis().burnRate()).isEqualByComparingTo("0.00");
        assertThat(forecast.kpis().runwayUnbounded()).isTrue();
        assertThat(forecast.kpis().minBalance()).isEqualByComparingTo("100000.00");
        assertThat(forecast.kpis().minBalanceWeek()).isEqualTo(10);
        assertThat(forecast.insights()).containsExactly(
                "Liquidity position is stable across the 4-week horizon",
                "Outflow ratio: projected outflows amount to 0% of expected inflows");
    }

    @Test
    void weeksChainOpeningToPreviousClosing() {
        LiquidityForecast forecast = projector.project(payrollAndRevenueHistory(), parameters("60000", "50000", 13));

        List<LiquidityWeek> weeks = forecast.weeks();
        assertThat(weeks.get(0).openingBalance()).isEqualByComparingTo("60000.00");
        for (int i = 0; i < weeks.size(); i++) {
            LiquidityWeek week = weeks.get(i);
            assertThat(week.index()).isEqualTo(i);
            assertThat(week.netCashflow()).isEqualByComparingTo(week.inflow().subtract(week.outflow()));
            assertThat(week.closingBalance()).isEqualByComparingTo(week.openingBalance().add(week.netCashflow()));
            if (i > 0) {
                assertThat(week.openingBalance()).isEqualByComparingTo(weeks.get(i - 1).closingBalance());
            }
        }
    }

    @Test
    void weeksStartOnMondayAndSpanSevenDays() {
        LiquidityForecast forecast = projector.project(List.of(),
                new ForecastParameters(new BigDecimal("1000"), new BigDecimal("500"), 3, LocalDate.of(2024, 3, 7)));

        assertThat(forecast.weeks()).allSatisfy(week -> {
            assertThat(week.startDate().getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
            assertThat(week.endDate()).isEqualTo(week.startDate().plusDays(6));
        });
        assertThat(forecast.weeks().get(0).startDate()).isEqualTo(LocalDate.of(2024, 3, 4));
    }

    @Test
    void confidenceDecaysWeeklyAndStopsAtFloor() {
        LiquidityForecast forecast = projector.project(List.of(), parameters("100000", "50000", 20));

        List<LiquidityWeek> weeks = forecast.weeks();
        assertThat(weeks.get(0).confidence()).isEqualByComparingTo("1.00");
        assertThat(weeks.get(1).confidence()).isEqualByComparingTo("0.96");
        assertThat(weeks.get(12).confidence()).isEqualByComparingTo("0.46");
        assertThat(weeks.get(19).confidence()).isEqualByComparingTo("0.40");
        for (int i = 1; i < weeks.size(); i++) {
            assertThat(weeks.get(i).confidence()).isLessThanOrEqualTo(weeks.get(i - 1).confidence());
            assertThat(weeks.get(i).confidence()).isGreaterThanOrEqualTo(new BigDecimal("0.40"));
        }
    }

    @Test
    void closingBalanceStaysInsideUncertaintyBand() {
        LiquidityForecast forecast = projector.project(payrollAndRevenueHistory(), parameters("60000", "50000", 13));

        assertThat(forecast.weeks()).allSatisfy(week -> {
            assertThat(week.lowerBound()).isLessThanOrEqualTo(week.closingBalance());
            assertThat(week.upperBound()).isGreaterThanOrEqualTo(week.closingBalance());
        });
    }

    @Test
    void payrollOverlayOnlyHitsWeeksStartingAtMonthEnd() {
        List<Booking> history = List.of(
                booking("2024-01-26", "5000.00", 5000, "Team", "Lohn 01/2024"),
                booking("2024-02-26", "5000.00", 5000, "Team", "Lohn 02/2024")
        );

        LiquidityForecast forecast = projector.project(history, parameters("100000", "50000", 13));

        List<LiquidityWeek> weeks = forecast.weeks();
        // baseline 5000 / 4.3 every week, full payroll every fourth week
        assertThat(weeks.get(0).outflow()).isEqualByComparingTo("6162.79");
        assertThat(weeks.get(1).outflow()).isEqualByComparingTo("1162.79");
        assertThat(weeks.get(2).outflow()).isEqualByComparingTo("1162.79");
        assertThat(weeks.get(3).startDate()).isEqualTo(LocalDate.of(2024, 3, 25));
        assertThat(weeks.get(3).outflow()).isEqualByComparingTo("3662.79");
        assertThat(weeks.get(4).outflow()).isEqualByComparingTo("6162.79");
        assertThat(weeks.get(12).startDate()).isEqualTo(LocalDate.of(2024, 5, 27));
        assertThat(weeks.get(12).outflow()).isEqualByComparingTo("8662.79");
        for (LiquidityWeek week : weeks) {
            int day = week.startDate().getDayOfMonth();
            boolean overlaid = day >= 25 && day <= 28;
            boolean due = week.index() % 4 == 0;
            BigDecimal expected = new BigDecimal("1162.79")
                    .add(due ? new BigDecimal("5000") : BigDecimal.ZERO)
                    .add(overlaid ? new BigDecimal("2500") : BigDecimal.ZERO);
            assertThat(week.outflow()).as("week %d", week.index()).isEqualByComparingTo(expected);
        }
    }

    @Test
    void dueRecurringPatternsAppearAsRecurringCategories() {
        LiquidityForecast forecast = projector.project(payrollAndRevenueHistory(), parameters("60000", "50000", 5));

        List<CashflowCategory> firstWeek = forecast.weeks().get(0).categories();
        assertThat(firstWeek).extracting(CashflowCategory::name).contains("Personalkosten");
        CashflowCategory payroll = firstWeek.stream()
                .filter(category -> category.name().equals("Personalkosten"))
                .findFirst()
                .orElseThrow();
        assertThat(payroll.recurring()).isTrue();
        assertThat(payroll.confidence()).isEqualByComparingTo("1.00");
        assertThat(forecast.weeks().get(1).categories()).extracting(CashflowCategory::name)
                .doesNotContain("Personalkosten");
        assertThat(forecast.categoryBreakdown()).isNotEmpty();
    }

    @Test
    void decliningBalanceProducesRunwayAndAlerts() {
        LiquidityForecast forecast = projector.project(List.of(
                booking("2024-01-26", "20000.00", 5000, "Team", "Lohn"),
                booking("2024-02-26", "20000.00", 5000, "Team", "Lohn")
        ), parameters("60000", "50000", 13));

        assertThat(forecast.kpis().burnRate()).isPositive();
        // minimum balance is negative, so there is no buffer left
        assertThat(forecast.kpis().minBalance()).isNegative();
        assertThat(forecast.kpis().runway()).hasValueSatisfying(runway -> assertThat(runway).isEqualByComparingTo("0.00"));
        assertThat(forecast.insights()).contains("At the current burn rate the liquidity buffer lasts 0.0 weeks");
        assertThat(forecast.kpis().minBalance()).isLessThan(new BigDecimal("60000.00"));
        assertThat(forecast.alerts()).isNotEmpty();
        assertThat(forecast.insights()).anyMatch(insight -> insight.startsWith("Payroll run in CW"));
    }

    @Test
    void rentOverlayOnlyHitsWeeksStartingAtMonthStart() {
        LiquidityForecast forecast = projector.project(List.of(
                booking("2024-02-01", "1500.00", 4210, "Vermieter GmbH", "Miete"),
                booking("2024-03-01", "1500.00", 4210, "Vermieter GmbH", "Miete")
        ), parameters("100000", "50000", 13));

        List<LiquidityWeek> weeks = forecast.weeks();
        // baseline 1500 / 4.3, full rent every fourth week, half rent again when the week starts on day 1-5
        assertThat(weeks.get(0).startDate()).isEqualTo(LocalDate.of(2024, 3, 4));
        assertThat(weeks.get(0).outflow()).isEqualByComparingTo("2598.84");
        assertThat(weeks.get(1).outflow()).isEqualByComparingTo("348.84");
        assertThat(weeks.get(3).outflow()).isEqualByComparingTo("348.84");
        assertThat(weeks.get(4).startDate()).isEqualTo(LocalDate.of(2024, 4, 1));
        assertThat(weeks.get(4).outflow()).isEqualByComparingTo("2598.84");
        assertThat(weeks.get(8).outflow()).isEqualByComparingTo("1848.84");
        assertThat(weeks.get(12).outflow()).isEqualByComparingTo("1848.84");
    }

    @Test
    void energyAccountsGetNoRentOverlay() {
        LiquidityForecast forecast = projector.project(List.of(
                booking("2024-02-01", "1500.00", 4245, "Stadtwerke", "Strom"),
                booking("2024-03-01", "1500.00", 4245, "Stadtwerke", "Strom")
        ), parameters("100000", "50000", 5));

        assertThat(forecast.recurringPatterns()).extracting(RecurringPattern::category).containsExactly("Energie");
        assertThat(forecast.weeks().get(0).outflow()).isEqualByComparingTo("1848.84");
        assertThat(forecast.weeks().get(4).outflow()).isEqualByComparingTo("1848.84");
    }

    @Test
    void weeklyAndBiweeklyPatternsFollowTheirCadence() {
        LiquidityForecast forecast = projector.project(List.of(
                booking("2024-02-09", "250.00", 3400, "Grosshandel", "Wareneinkauf"),
                booking("2024-02-16", "250.00", 3400, "Grosshandel", "Wareneinkauf"),
                booking("2024-02-23", "250.00", 3400, "Grosshandel", "Wareneinkauf"),
                booking("2024-03-01", "250.00", 3400, "Grosshandel", "Wareneinkauf"),
                booking("2024-02-12", "700.00", 8400, "Kunde AG", "Abschlag"),
                booking("2024-02-26", "700.00", 8400, "Kunde AG", "Abschlag")
        ), parameters("100000", "50000", 6));

        // weekly 250 x 0.92 on top of 1000 / 4.3; biweekly 700 x 0.92 on top of 1400 / 4.3
        for (LiquidityWeek week : forecast.weeks()) {
            assertThat(week.outflow()).as("outflow week %d", week.index()).isEqualByComparingTo("462.56");
            String expectedInflow = week.index() % 2 == 0 ? "969.58" : "325.58";
            assertThat(week.inflow()).as("inflow week %d", week.index()).isEqualByComparingTo(expectedInflow);
        }
    }

    @Test
    void quarterlyPatternLandsEveryThirteenWeeks() {
        ForecastSettings quarterlyRate = ForecastSettings.defaults().toBuilder().annualizationFactor(4).build();
        WeeklyCashflowProjector quarterlyProjector = ForecastFixtures.projector(quarterlyRate);

        LiquidityForecast forecast = quarterlyProjector.project(List.of(
                booking("2023-12-01", "1200.00", 4360, "Allianz", "Versicherung"),
                booking("2024-03-01", "1200.00", 4360, "Allianz", "Versicherung")
        ), parameters("100000", "50000", 14));

        assertThat(forecast.recurringPatterns()).extracting(RecurringPattern::frequency)
                .containsExactly(Frequency.QUARTERLY);
        for (LiquidityWeek week : forecast.weeks()) {
            String expected = week.index() % 13 == 0 ? "1479.07" : "279.07";
            assertThat(week.outflow()).as("week %d", week.index()).isEqualByComparingTo(expected);
        }
    }

    @Test
    void largeWeeklyDropsRaiseInfoAlertsAfterFirstWeek() {
        LiquidityForecast forecast = projector.project(List.of(
                booking("2024-01-26", "20000.00", 5000, "Team", "Lohn"),
                booking("2024-02-26", "20000.00", 5000, "Team", "Lohn")
        ), parameters("60000", "50000", 13));

        List<LiquidityAlert> drops = forecast.alerts().stream()
                .filter(alert -> alert.severity() == LiquidityAlert.Severity.INFO)
                .toList();
        // week 0 (CW 10) has the same outflow as CW 14 but is never a drop alert
        assertThat(drops).extracting(LiquidityAlert::calendarWeek).containsExactly(13, 14, 18, 22);
        assertThat(drops.get(1).message()).isEqualTo("CW 14: large cashflow drop - EUR 24.651,16 expected");
    }

    @Test
    void refundOnExpenseAccountDoesNotFlipCategoryDirection() {
        LiquidityForecast forecast = projector.project(List.of(
                booking("2024-01-26", "5000.00", 5000, "Team", "Lohn 01/2024"),
                booking("2024-02-26", "5000.00", 5000, "Team", "Lohn 02/2024"),
                booking("2024-03-04", "-200.00", 5010, "Team", "Lohnkorrektur")
        ), new ForecastParameters(new BigDecimal("100000"), new BigDecimal("50000"), 13, LocalDate.of(2024, 3, 5)));

        List<CashflowCategory> firstWeek = forecast.weeks().get(0).categories();
        assertThat(firstWeek).hasSize(2);
        CashflowCategory payroll = category(firstWeek, "Personalkosten", CashflowDirection.OUTFLOW);
        assertThat(payroll.amount()).isEqualByComparingTo("5000.00");
        assertThat(payroll.recurring()).isTrue();
        CashflowCategory refund = category(firstWeek, "Personalkosten", CashflowDirection.INFLOW);
        assertThat(refund.amount()).isEqualByComparingTo("200.00");
        assertThat(refund.recurring()).isFalse();

        CategoryBreakdownItem payrollTotal = forecast.categoryBreakdown().stream()
                .filter(item -> item.direction() == CashflowDirection.OUTFLOW)
                .findFirst()
                .orElseThrow();
        assertThat(payrollTotal.name()).isEqualTo("Personalkosten");
        assertThat(payrollTotal.totalAmount()).isEqualByComparingTo("20000.00");
        assertThat(payrollTotal.percentage()).isEqualByComparingTo("100.00");
        assertThat(forecast.insights()).contains("Primary cost driver: Personalkosten (100% of outflows)");
    }

    @Test
    void identicalInputsProduceIdenticalForecasts() {
        List<Booking> history = payrollAndRevenueHistory();
        ForecastParameters parameters = parameters("60000", "50000", 13);

        assertThat(projector.project(history, parameters)).isEqualTo(projector.project(history, parameters));
    }

    private static CashflowCategory category(List<CashflowCategory> categories, String name, CashflowDirection direction) {
        return categories.stream()
                .filter(category -> category.name().equals(name) && category.direction() == direction)
                .findFirst()
                .orElseThrow();
    }

    private static List<Booking> payrollAndRevenueHistory() {
        return List.of(
                booking("2024-01-26", "8000.00", 5000, "Team", "Lohn 01/2024"),
                booking("2024-02-26", "8000.00", 5000, "Team", "Lohn 02/2024"),
                booking("2024-02-01", "1500.00", 4210, "Vermieter GmbH", "Miete"),
                booking("2024-03-01", "1500.00", 4210, "Vermieter GmbH", "Miete"),
                booking("2024-02-12", "6000.00", 8400, "Kunde AG", "Abschlag"),
                booking("2024-02-26", "6000.00", 8400, "Kunde AG", "Abschlag"),
                booking("2024-02-15", "400.00", 3400, "Grosshandel", "Material")
        );
    }

    private static ForecastParameters parameters(String startBalance, String threshold, int weeks) {
        return new ForecastParameters(new BigDecimal(startBalance), new BigDecimal(threshold), weeks, NOW);
    }
}
