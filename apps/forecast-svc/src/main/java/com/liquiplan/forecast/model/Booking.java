package com.liquiplan.forecast.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A single posted ledger entry as supplied by the upstream bookkeeping export.
 * Positive amounts follow the account's natural direction; negative amounts reverse it.
 */
public record Booking(
        LocalDate postingDate,
        BigDecimal amount,
        int account,
        String counterparty,
        String text
) {
    public boolean hasCounterparty() {
        return counterparty != null && !counterparty.isBlank();
    }

    public String textOrEmpty() {
        return text == null ? "" : text;
    }
}
