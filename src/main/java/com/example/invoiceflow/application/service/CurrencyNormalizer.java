package com.example.invoiceflow.application.service;

import com.example.invoiceflow.domain.model.FxQuote;
import com.example.invoiceflow.domain.model.RateTable;
import com.example.invoiceflow.domain.port.RateService;
import com.example.invoiceflow.infrastructure.fx.FxProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Looks up the rate that converts a foreign currency into the configured base currency.
 * Lookup failures never propagate; they produce {@link FxQuote#unavailable()}.
 */
@Service
public class CurrencyNormalizer {

    private static final Logger log = LoggerFactory.getLogger(CurrencyNormalizer.class);
    private static final int AMOUNT_SCALE = 2;

    private final RateService rateService;
    private final String baseCurrency;

    /**
     * @param rateService source of live rate tables
     * @param properties  FX settings; only the base currency is read here
     */
    public CurrencyNormalizer(RateService rateService, FxProperties properties) {
        this.rateService = rateService;
        this.baseCurrency = properties.baseCurrency();
    }

    /**
     * @return ISO code every foreign total is normalized to
     */
    public String baseCurrency() {
        return baseCurrency;
    }

    /**
     * Fetches the rate table anchored at {@code sourceCurrency} and picks the base-currency entry.
     *
     * @param sourceCurrency ISO code of the amount to convert
     * @return rate and as-of timestamp, or an unavailable quote
     */
    public FxQuote rateToBase(String sourceCurrency) {
        try {
            RateTable table = rateService.latestRates(sourceCurrency);
            BigDecimal rate = table == null ? null : table.rateFor(baseCurrency);
            if (rate == null) {
                log.warn("Rate table for {} carries no {} entry", sourceCurrency, baseCurrency);
                return FxQuote.unavailable();
            }
            return new FxQuote(rate, table.asOf());
        } catch (RuntimeException ex) {
            log.warn("Rate lookup {} -> {} failed; leaving amount unnormalized", sourceCurrency, baseCurrency, ex);
            return FxQuote.unavailable();
        }
    }

    /**
     * @param amount amount in the source currency
     * @param quote  available quote
     * @return amount in the base currency rounded half-up to cents, or {@code null} when the product
     *         cannot be represented at cent scale
     */
    public BigDecimal convert(BigDecimal amount, FxQuote quote) {
        try {
            return amount.multiply(quote.rate()).setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
        } catch (ArithmeticException ex) {
            log.warn("Cannot convert {} at rate {}; leaving amount unnormalized", amount, quote.rate(), ex);
            return null;
        }
    }
}
