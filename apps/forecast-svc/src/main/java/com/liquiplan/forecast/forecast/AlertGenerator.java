package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.LiquidityAlert;
import com.liquiplan.forecast.model.LiquidityWeek;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class AlertGenerator {

    private final ForecastSettings settings;

    public AlertGenerator(ForecastSettings settings) {
        this.settings = settings;
    }

    /**
     * Evaluates every week on its own; one week may raise a balance alert and a drop alert.
     */
    public List<LiquidityAlert> generate(List<LiquidityWeek> weeks, BigDecimal threshold) {
        List<LiquidityAlert> alerts = new ArrayList<>();
        for (LiquidityWeek week : weeks) {
            BigDecimal closing = week.closingBalance();
            if (closing.signum() > 0 && closing.compareTo(threshold) < 0) {
                alerts.add(new LiquidityAlert(
                        week.calendarWeek(),
                        LiquidityAlert.Severity.WARNING,
                        "CW " + week.calendarWeek() + ": balance below threshold - EUR " + Money.format(closing) + " expected",
                        closing));
            } else if (closing.signum() <= 0) {
                alerts.add(new LiquidityAlert(
                        week.calendarWeek(),
                        LiquidityAlert.Severity.CRITICAL,
                        "CW " + week.calendarWeek() + ": critical shortfall - EUR " + Money.format(closing) + " expected",
                        closing));
            }

            if (week.index() > 0 && week.netCashflow().compareTo(settings.largeDropThreshold()) < 0) {
                alerts.add(new LiquidityAlert(
                        week.calendarWeek(),
                        LiquidityAlert.Severity.INFO,
                        "CW " + week.calendarWeek() + ": large cashflow drop - EUR " + Money.format(week.netCashflow().abs()) + " expected",
                        closing));
            }
        }
        return alerts;
    }
}
