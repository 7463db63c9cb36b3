package com.liquiplan.forecast.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record LiquidityForecastRequestDto(
        @NotNull List<@NotNull @Valid BookingDto> bookings,
        @NotNull BigDecimal startBalance,
        @Positive BigDecimal threshold,
        @Positive @Max(104) Integer weeks,
        LocalDate now,
        Boolean enrichNarrative
) {

    public boolean enrichNarrativeRequested() {
        return Boolean.TRUE.equals(enrichNarrative);
    }

    public record BookingDto(
            @NotNull @JsonAlias("posting_date") LocalDate postingDate,
            @NotNull BigDecimal amount,
            @NotNull Integer account,
            @JsonAlias("vendor") String counterparty,
            String text
    ) {
    }
}
