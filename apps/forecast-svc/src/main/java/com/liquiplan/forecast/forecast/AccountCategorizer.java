package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.AccountCategory;
import com.liquiplan.forecast.model.Booking;
import com.liquiplan.forecast.model.CashflowDirection;

/**
 * Sole authority on how an account number maps to a cashflow category and direction.
 */
public interface AccountCategorizer {

    AccountCategory categorize(int account);

    String colorFor(String categoryName);

    /**
     * Direction of the cash movement behind a booking: positive amounts follow the account's
     * natural direction, negative amounts (refunds, reversals) run the other way.
     */
    default CashflowDirection directionOf(Booking booking) {
        CashflowDirection natural = categorize(booking.account()).direction();
        return booking.amount().signum() > 0 ? natural : natural.opposite();
    }
}
