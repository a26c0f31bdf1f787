package com.example.invoiceflow.domain.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Full rate table anchored at {@code baseCurrency}, as returned by the rate service.
 */
public record RateTable(
        String baseCurrency,
        String asOf,
        Map<String, BigDecimal> rates
) {

    public RateTable {
        rates = rates == null ? Map.of() : Map.copyOf(rates);
    }

    /**
     * @param currency ISO currency code
     * @return rate for one unit of {@link #baseCurrency()} in {@code currency}, or {@code null}
     */
    public BigDecimal rateFor(String currency) {
        return currency == null ? null : rates.get(currency);
    }
}
