package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.Frequency;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Tunable constants of the forecast heuristics. {@link #defaults()} reproduces the calibrated values;
 * tests and deployments substitute their own through {@link #builder()}.
 */
public record ForecastSettings(
        BigDecimal defaultThreshold,
        int defaultWeeks,
        int trailingWindowDays,
        double annualizationFactor,
        BigDecimal trailingWindowWeeks,
        List<FrequencyBand> frequencyBands,
        BigDecimal confidenceDecayPerWeek,
        BigDecimal confidenceFloor,
        BigDecimal bandWideningPerWeek,
        BigDecimal fallbackStdDev,
        BigDecimal overlayFactor,
        String payrollCategory,
        DayWindow payrollWindow,
        String rentCategory,
        DayWindow rentWindow,
        BigDecimal largeDropThreshold,
        int maxInsights
) {

    public ForecastSettings {
        if (defaultThreshold == null || defaultThreshold.signum() <= 0) {
            throw new IllegalArgumentException("defaultThreshold must be positive");
        }
        if (defaultWeeks <= 0) {
            throw new IllegalArgumentException("defaultWeeks must be positive");
        }
        if (trailingWindowDays <= 0) {
            throw new IllegalArgumentException("trailingWindowDays must be positive");
        }
        if (trailingWindowWeeks == null || trailingWindowWeeks.signum() <= 0) {
            throw new IllegalArgumentException("trailingWindowWeeks must be positive");
        }
        if (frequencyBands == null || frequencyBands.isEmpty()) {
            throw new IllegalArgumentException("frequencyBands must be provided");
        }
        if (fallbackStdDev == null || fallbackStdDev.signum() < 0) {
            throw new IllegalArgumentException("fallbackStdDev must not be negative");
        }
        if (payrollCategory == null || payrollCategory.isBlank() || rentCategory == null || rentCategory.isBlank()) {
            throw new IllegalArgumentException("payroll and rent categories must be provided");
        }
        if (payrollWindow == null || rentWindow == null) {
            throw new IllegalArgumentException("payroll and rent day windows must be provided");
        }
        if (largeDropThreshold == null) {
            throw new IllegalArgumentException("largeDropThreshold must be provided");
        }
        frequencyBands = List.copyOf(frequencyBands);
    }

    public static ForecastSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .defaultThreshold(defaultThreshold)
                .defaultWeeks(defaultWeeks)
                .trailingWindowDays(trailingWindowDays)
                .annualizationFactor(annualizationFactor)
                .trailingWindowWeeks(trailingWindowWeeks)
                .frequencyBands(frequencyBands)
                .confidenceDecayPerWeek(confidenceDecayPerWeek)
                .confidenceFloor(confidenceFloor)
                .bandWideningPerWeek(bandWideningPerWeek)
                .fallbackStdDev(fallbackStdDev)
                .overlayFactor(overlayFactor)
                .payrollCategory(payrollCategory)
                .payrollWindow(payrollWindow)
                .rentCategory(rentCategory)
                .rentWindow(rentWindow)
                .largeDropThreshold(largeDropThreshold)
                .maxInsights(maxInsights);
    }

    public Optional<FrequencyBand> bandFor(double annualRate) {
        return frequencyBands.stream().filter(band -> band.matches(annualRate)).findFirst();
    }

    public FrequencyBand band(Frequency frequency) {
        return frequencyBands.stream()
                .filter(band -> band.frequency() == frequency)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No frequency band configured for " + frequency));
    }

    public static final class Builder {
        private BigDecimal defaultThreshold = new BigDecimal("50000.00");
        private int defaultWeeks = 13;
        private int trailingWindowDays = 30;
        private double annualizationFactor = 12d;
        private BigDecimal trailingWindowWeeks = new BigDecimal("4.3");
        private List<FrequencyBand> frequencyBands = List.of(
                new FrequencyBand(Frequency.WEEKLY, 40, Double.POSITIVE_INFINITY, 52, 1),
                new FrequencyBand(Frequency.BIWEEKLY, 20, 40, 26, 2),
                new FrequencyBand(Frequency.MONTHLY, 10, 14, 12, 4),
                new FrequencyBand(Frequency.QUARTERLY, 3, 5, 4, 13)
        );
        private BigDecimal confidenceDecayPerWeek = new BigDecimal("0.045");
        private BigDecimal confidenceFloor = new BigDecimal("0.4");
        private BigDecimal bandWideningPerWeek = new BigDecimal("0.1");
        private BigDecimal fallbackStdDev = new BigDecimal("5000.00");
        private BigDecimal overlayFactor = new BigDecimal("0.5");
        private String payrollCategory = "Personalkosten";
        private DayWindow payrollWindow = new DayWindow(25, 28);
        private String rentCategory = "Raumkosten";
        private DayWindow rentWindow = new DayWindow(1, 5);
        private BigDecimal largeDropThreshold = new BigDecimal("-10000.00");
        private int maxInsights = 5;

        public Builder defaultThreshold(BigDecimal defaultThreshold) {
            this.defaultThreshold = defaultThreshold;
            return this;
        }

        public Builder defaultWeeks(int defaultWeeks) {
            this.defaultWeeks = defaultWeeks;
            return this;
        }

        public Builder trailingWindowDays(int trailingWindowDays) {
            this.trailingWindowDays = trailingWindowDays;
            return this;
        }

        public Builder annualizationFactor(double annualizationFactor) {
            this.annualizationFactor = annualizationFactor;
            return this;
        }

        public Builder trailingWindowWeeks(BigDecimal trailingWindowWeeks) {
            this.trailingWindowWeeks = trailingWindowWeeks;
            return this;
        }

        public Builder frequencyBands(List<FrequencyBand> frequencyBands) {
            this.frequencyBands = frequencyBands;
            return this;
        }

        public Builder confidenceDecayPerWeek(BigDecimal confidenceDecayPerWeek) {
            this.confidenceDecayPerWeek = confidenceDecayPerWeek;
            return this;
        }

        public Builder confidenceFloor(BigDecimal confidenceFloor) {
            this.confidenceFloor = confidenceFloor;
            return this;
        }

        public Builder bandWideningPerWeek(BigDecimal bandWideningPerWeek) {
            this.bandWideningPerWeek = bandWideningPerWeek;
            return this;
        }

        public Builder fallbackStdDev(BigDecimal fallbackStdDev) {
            this.fallbackStdDev = fallbackStdDev;
            return this;
        }

        public Builder overlayFactor(BigDecimal overlayFactor) {
            this.overlayFactor = overlayFactor;
            return this;
        }

        public Builder payrollCategory(String payrollCategory) {
            this.payrollCategory = payrollCategory;
            return this;
        }

        public Builder payrollWindow(DayWindow payrollWindow) {
            this.payrollWindow = payrollWindow;
            return this;
        }

        public Builder rentCategory(String rentCategory) {
            this.rentCategory = rentCategory;
            return this;
        }

        public Builder rentWindow(DayWindow rentWindow) {
            this.rentWindow = rentWindow;
            return this;
        }

        public Builder largeDropThreshold(BigDecimal largeDropThreshold) {
            this.largeDropThreshold = largeDropThreshold;
            return this;
        }

        public Builder maxInsights(int maxInsights) {
            this.maxInsights = maxInsights;
            return this;
        }

        public ForecastSettings build() {
            return new ForecastSettings(
                    defaultThreshold,
                    defaultWeeks,
                    trailingWindowDays,
                    annualizationFactor,
                    trailingWindowWeeks,
                    frequencyBands,
                    confidenceDecayPerWeek,
                    confidenceFloor,
                    bandWideningPerWeek,
                    fallbackStdDev,
                    overlayFactor,
                    payrollCategory,
                    payrollWindow,
                    rentCategory,
                    rentWindow,
                    largeDropThreshold,
                    maxInsights
            );
        }
    }
}
