package com.example.invoiceflow.application.service;

import com.example.invoiceflow.domain.model.FxQuote;
import com.example.invoiceflow.domain.model.RateTable;
import com.example.invoiceflow.domain.port.RateService;
import com.example.invoiceflow.infrastructure.fx.FxProperties;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

class CurrencyNormalizerTest {

    private final RateService rateService = mock(RateService.class);
    private final CurrencyNormalizer normalizer = new CurrencyNormalizer(rateService,
            new FxProperties("http://rates.test", "key", Duration.ofSeconds(1), "TWD"));

    @Test
    void picksBaseCurrencyEntryFromRateTable() {
        given(rateService.latestRates("JPY")).willReturn(new RateTable("JPY", "Mon, 01 Jan 2024 00:00:01 +0000",
                Map.of("TWD", new BigDecimal("0.2150"), "USD", new BigDecimal("0.0068"))));

        FxQuote quote = normalizer.rateToBase("JPY");

        assertThat(quote.isAvailable()).isTrue();
        assertThat(quote.rate()).isEqualByComparingTo("0.2150");
        assertThat(quote.asOf()).isEqualTo("Mon, 01 Jan 2024 00:00:01 +0000");
    }

    @Test
    void missingBaseEntryIsUnavailable() {
        given(rateService.latestRates("EUR")).willReturn(new RateTable("EUR", "2024-01-01", Map.of("USD", BigDecimal.ONE)));

        assertThat(normalizer.rateToBase("EUR").isAvailable()).isFalse();
    }

    @Test
    void nullRateTableIsUnavailable() {
        given(rateService.latestRates("EUR")).willReturn(null);

        assertThat(normalizer.rateToBase("EUR")).isEqualTo(FxQuote.unavailable());
    }

    /**
     * Conversion rounds half up to two decimals.
     */
    @Test
    void convertRoundsHalfUpToCents() {
        FxQuote quote = new FxQuote(new BigDecimal("32.0"), "2024-01-01");

        assertThat(normalizer.convert(new BigDecimal("49.99"), quote)).isEqualTo(new BigDecimal("1599.68"));
        assertThat(normalizer.convert(new BigDecimal("0.005"), new FxQuote(BigDecimal.ONE, null)))
                .isEqualTo(new BigDecimal("0.01"));
    }

    /**
     * A product that cannot be rescaled to cents yields no converted amount instead of an exception.
     */
    @Test
    void unrepresentableProductYieldsNull() {
        FxQuote quote = new FxQuote(new BigDecimal("32.0"), "2024-01-01");

        assertThat(normalizer.convert(new BigDecimal("1e999999999"), quote)).isNull();
    }
}
