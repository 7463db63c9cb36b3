package com.liquiplan.forecast.config;

import com.liquiplan.forecast.forecast.AccountCategoryTable;
import com.liquiplan.forecast.forecast.AccountRange;
import com.liquiplan.forecast.forecast.DayWindow;
import com.liquiplan.forecast.forecast.ForecastSettings;
import com.liquiplan.forecast.model.CashflowDirection;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "liquiplan")
public record LiquiplanProperties(
        Forecast forecast,
        Categories categories,
        Ai ai
) {

    @ConstructorBinding
    public LiquiplanProperties {
        if (ai == null) {
            throw new IllegalArgumentException("ai configuration must be provided");
        }
        // forecast and categories are optional; calibrated defaults apply when absent
        if (forecast == null) {
            forecast = new Forecast(null, null, null, null, null, null, null, null);
        }
        if (categories == null) {
            categories = new Categories(null, null);
        }
    }

    public record Forecast(
            BigDecimal threshold,
            Integer weeks,
            BigDecimal largeDropThreshold,
            BigDecimal fallbackStdDev,
            Integer payrollFirstDay,
            Integer payrollLastDay,
            Integer rentFirstDay,
            Integer rentLastDay
    ) {
        public Forecast {
            if (threshold != null && threshold.signum() <= 0) {
                throw new IllegalArgumentException("threshold must be positive");
            }
            if (weeks != null && weeks <= 0) {
                throw new IllegalArgumentException("weeks must be positive");
            }
            if (fallbackStdDev != null && fallbackStdDev.signum() < 0) {
                throw new IllegalArgumentException("fallbackStdDev must not be negative");
            }
        }

        public ForecastSettings applyTo(ForecastSettings base) {
            ForecastSettings.Builder builder = base.toBuilder();
            if (threshold != null) {
                builder.defaultThreshold(threshold);
            }
            if (weeks != null) {
                builder.defaultWeeks(weeks);
            }
            if (largeDropThreshold != null) {
                builder.largeDropThreshold(largeDropThreshold);
            }
            if (fallbackStdDev != null) {
                builder.fallbackStdDev(fallbackStdDev);
            }
            DayWindow payroll = base.payrollWindow();
            builder.payrollWindow(new DayWindow(
                    payrollFirstDay != null ? payrollFirstDay : payroll.firstDay(),
                    payrollLastDay != null ? payrollLastDay : payroll.lastDay()));
            DayWindow rent = base.rentWindow();
            builder.rentWindow(new DayWindow(
                    rentFirstDay != null ? rentFirstDay : rent.firstDay(),
                    rentLastDay != null ? rentLastDay : rent.lastDay()));
            return builder.build();
        }
    }

    public record Categories(Integer expenseBoundary, List<Range> ranges) {

        public AccountCategoryTable toTable() {
            int boundary = expenseBoundary != null ? expenseBoundary : AccountCategoryTable.DEFAULT_EXPENSE_BOUNDARY;
            if (ranges == null || ranges.isEmpty()) {
                return expenseBoundary == null
                        ? AccountCategoryTable.defaults()
                        : AccountCategoryTable.withRanges(AccountCategoryTable.defaults().ranges(), boundary);
            }
            return AccountCategoryTable.withRanges(ranges.stream().map(Range::toAccountRange).toList(), boundary);
        }
    }

    public record Range(String name, Integer from, Integer to, String direction, String color) {
        public Range {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("category name must be provided");
            }
            if (from == null || to == null) {
                throw new IllegalArgumentException("account range bounds must be provided for " + name);
            }
            if (direction == null || direction.isBlank()) {
                throw new IllegalArgumentException("direction must be provided for " + name);
            }
        }

        AccountRange toAccountRange() {
            CashflowDirection parsed;
            try {
                parsed = CashflowDirection.valueOf(direction.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("direction must be inflow or outflow for " + name, ex);
            }
            return new AccountRange(name, from, to, parsed, color);
        }
    }

    public record Ai(String model, String endpoint, String apiKey, Long timeoutMs) {
        public Ai {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model must be provided");
            }
            if (endpoint == null || endpoint.isBlank()) {
                throw new IllegalArgumentException("endpoint must be provided");
            }
            if (timeoutMs != null && timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive");
            }
            // apiKey may be blank; narrative enrichment is skipped without it
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public long timeoutOrDefault() {
            return timeoutMs != null ? timeoutMs : 8_000L;
        }
    }
}
