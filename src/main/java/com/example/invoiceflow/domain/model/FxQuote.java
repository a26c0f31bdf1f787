package com.example.invoiceflow.domain.model;

import java.math.BigDecimal;

/**
 * Conversion rate into the base currency together with the rate's as-of timestamp.
 * Both values are {@code null} when no rate could be obtained.
 */
public record FxQuote(
        BigDecimal rate,
        String asOf
) {

    private static final FxQuote UNAVAILABLE = new FxQuote(null, null);

    public static FxQuote unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return rate != null;
    }
}
