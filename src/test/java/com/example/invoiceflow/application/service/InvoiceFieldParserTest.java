package com.example.invoiceflow.application.service;

import com.example.invoiceflow.domain.model.InvoiceFields;
import com.example.invoiceflow.domain.model.RateTable;
import com.example.invoiceflow.domain.port.RateService;
import com.example.invoiceflow.infrastructure.fx.FxProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for the line-oriented invoice field parser.
 */
class InvoiceFieldParserTest {

    private RateService rateService;
    private InvoiceFieldParser parser;

    @BeforeEach
    void setUp() {
        rateService = mock(RateService.class);
        FxProperties properties = new FxProperties("http://rates.test", "key", Duration.ofSeconds(5), "TWD");
        parser = new InvoiceFieldParser(new CurrencyNormalizer(rateService, properties));
    }

    /**
     * Verifies that a foreign total is converted with the looked-up rate and rounded to cents.
     */
    @Test
    void foreignTotalIsNormalizedToBaseCurrency() {
        given(rateService.latestRates("USD"))
                .willReturn(new RateTable("USD", "2024-01-01", Map.of("TWD", new BigDecimal("31.5"))));

        InvoiceFields fields = parser.parse("Invoice #: INV-1\nInvoice Date: 2024-01-01\nTotal: USD 100.00");

        assertThat(fields.invoiceNumber()).isEqualTo("INV-1");
        assertThat(fields.invoiceDate()).isEqualTo("2024-01-01");
        assertThat(fields.currency()).isEqualTo("USD");
        assertThat(fields.totalAmount()).isEqualByComparingTo("100.00");
        assertThat(fields.fxRate()).isEqualByComparingTo("31.5");
        assertThat(fields.fxRateDate()).isEqualTo("2024-01-01");
        assertThat(fields.amountInBaseCurrency()).isEqualTo(new BigDecimal("3150.00"));
    }

    /**
     * Without a currency marker the total is assumed to be in the base currency and no rate is fetched.
     */
    @Test
    void totalWithoutMarkerDefaultsToBaseCurrency() {
        InvoiceFields fields = parser.parse("Total 1,200");

        assertThat(fields.currency()).isEqualTo("TWD");
        assertThat(fields.totalAmount()).isEqualByComparingTo("1200");
        assertThat(fields.fxRate()).isNull();
        assertThat(fields.amountInBaseCurrency()).isNull();
        verifyNoInteractions(rateService);
    }

    /**
     * A failing rate service leaves the parsed total in place and the conversion fields empty.
     */
    @Test
    void rateFailureKeepsTotalUnnormalized() {
        given(rateService.latestRates(anyString())).willThrow(new IllegalStateException("rate service down"));

        InvoiceFields fields = parser.parse("Total: USD 49.99");

        assertThat(fields.currency()).isEqualTo("USD");
        assertThat(fields.totalAmount()).isEqualByComparingTo("49.99");
        assertThat(fields.fxRate()).isNull();
        assertThat(fields.fxRateDate()).isNull();
        assertThat(fields.amountInBaseCurrency()).isNull();
        verify(rateService).latestRates("USD");
    }

    @Test
    void foreignCurrencyWithoutAmountSkipsRateLookup() {
        InvoiceFields fields = parser.parse("Total in USD");

        assertThat(fields.currency()).isEqualTo("USD");
        assertThat(fields.totalAmount()).isNull();
        verifyNoInteractions(rateService);
    }

    /**
     * When several lines carry a total label the last amount wins, while a later line without an
     * amount does not erase it.
     */
    @Test
    void lastTotalLineWins() {
        InvoiceFields fields = parser.parse("Subtotal: NT$ 500\nTotal: NT$ 525\nTotal pages");

        assertThat(fields.currency()).isEqualTo("TWD");
        assertThat(fields.totalAmount()).isEqualByComparingTo("525");
    }

    /**
     * Exponent tokens are not amounts, so they can neither become the total nor break the conversion.
     */
    @Test
    void exponentTokensAreNotAmounts() {
        given(rateService.latestRates("USD"))
                .willReturn(new RateTable("USD", "2024-01-01", Map.of("TWD", new BigDecimal("32.0"))));

        InvoiceFields huge = parser.parse("Total: USD 1e999999999");
        InvoiceFields small = parser.parse("Total: USD 1e5");

        assertThat(huge.currency()).isEqualTo("USD");
        assertThat(huge.totalAmount()).isNull();
        assertThat(huge.amountInBaseCurrency()).isNull();
        assertThat(small.totalAmount()).isNull();
    }

    @Test
    void oversizedPlainTotalIsStillConverted() {
        given(rateService.latestRates("USD"))
                .willReturn(new RateTable("USD", "2024-01-01", Map.of("TWD", new BigDecimal("32.0"))));

        InvoiceFields fields = parser.parse("Total: USD 99,999,999,999,999,999,999,999,999.999");

        assertThat(fields.totalAmount()).isEqualByComparingTo("99999999999999999999999999.999");
        assertThat(fields.amountInBaseCurrency()).isEqualTo(new BigDecimal("3199999999999999999999999999.97"));
    }

    @Test
    void usdMarkerBeatsTwdMarkerOnSameLine() {
        InvoiceFields fields = parser.parse("Total: NT 100 USD");

        assertThat(fields.currency()).isEqualTo("USD");
        assertThat(fields.totalAmount()).isEqualByComparingTo("100");
    }

    /**
     * Verifies the Chinese labels, full-width colons and vendor table.
     */
    @Test
    void chineseReceiptIsParsed() {
        String text = String.join("\n",
                "統一超商 收銀機統一發票",
                "發票號碼：AB-12345678",
                "發票日期：2024/03/05",
                "總計 350 元");

        InvoiceFields fields = parser.parse(text);

        assertThat(fields.invoiceNumber()).isEqualTo("AB-12345678");
        assertThat(fields.invoiceDate()).isEqualTo("2024/03/05");
        assertThat(fields.vendorName()).isEqualTo("7-ELEVEN");
        assertThat(fields.currency()).isEqualTo("TWD");
        assertThat(fields.totalAmount()).isEqualByComparingTo("350");
        assertThat(fields.rawText()).isEqualTo(text);
    }

    @Test
    void labelWithoutValueLeavesFieldUnknown() {
        InvoiceFields fields = parser.parse("Invoice No:\nInvoice Date:   ");

        assertThat(fields.invoiceNumber()).isNull();
        assertThat(fields.invoiceDate()).isNull();
    }

    @Test
    void vendorIsDetectedAnywhereInText() {
        assertThat(parser.parse("Billed by Amazon Web Services EMEA").vendorName()).isEqualTo("Amazon Web Services");
        assertThat(parser.parse("OPENAI, L.L.C.").vendorName()).isEqualTo("OpenAI");
        assertThat(parser.parse("Corner bakery").vendorName()).isEqualTo(InvoiceFields.UNKNOWN_VENDOR);
    }

    /**
     * Missing text yields the all-default record.
     */
    @Test
    void nullTextYieldsDefaults() {
        InvoiceFields fields = parser.parse(null);

        assertThat(fields).isEqualTo(InvoiceFields.empty("TWD"));
        assertThat(fields.vendorName()).isEqualTo(InvoiceFields.UNKNOWN_VENDOR);
        assertThat(fields.currency()).isEqualTo("TWD");
    }

    @Test
    void parsingIsRepeatable() {
        String text = "Invoice Number: 42\nTotal: TWD 1,234.50";

        assertThat(parser.parse(text)).isEqualTo(parser.parse(text));
    }
}
