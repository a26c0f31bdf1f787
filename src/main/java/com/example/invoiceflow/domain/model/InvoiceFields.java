package com.example.invoiceflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;

/**
 * Structured invoice fields parsed from raw document text.
 * Unknown values stay {@code null}; vendor and currency fall back to sentinels instead.
 * {@code amountInBaseCurrency} is only set when a foreign total was converted with a live rate.
 */
public record InvoiceFields(
        String invoiceNumber,
        String invoiceDate,
        String vendorName,
        BigDecimal totalAmount,
        String currency,
        BigDecimal fxRate,
        String fxRateDate,
        BigDecimal amountInBaseCurrency,
        String rawText
) {

    public static final String UNKNOWN_VENDOR = "unknown vendor";

    /**
     * @param baseCurrency currency used when nothing was detected
     * @return record with every field unknown
     */
    public static InvoiceFields empty(String baseCurrency) {
        return new InvoiceFields(null, null, UNKNOWN_VENDOR, null, baseCurrency, null, null, null, null);
    }

    /**
     * @return {@code true} when the total was converted to the base currency
     */
    @JsonIgnore
    public boolean isNormalized() {
        return amountInBaseCurrency != null;
    }
}
