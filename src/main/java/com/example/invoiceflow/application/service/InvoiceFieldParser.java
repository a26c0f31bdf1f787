package com.example.invoiceflow.application.service;

import com.example.invoiceflow.domain.model.FxQuote;
import com.example.invoiceflow.domain.model.InvoiceFields;
import com.example.invoiceflow.domain.model.InvoiceVocabulary;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Application-layer service that parses invoice fields out of raw document text with a line-oriented scan.
 * Total parsing never fails: unrecognized input simply leaves fields unknown.
 */
@Service
public class InvoiceFieldParser {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

    private final CurrencyNormalizer currencyNormalizer;

    /**
     * @param currencyNormalizer converter used when the total is in a foreign currency
     */
    public InvoiceFieldParser(CurrencyNormalizer currencyNormalizer) {
        this.currencyNormalizer = currencyNormalizer;
    }

    /**
     * Scans every line for invoice number, invoice date and total labels, then detects the vendor over
     * the whole text. When a later total line matches again its currency and amount replace earlier ones.
     *
     * @param rawText extracted document text, {@code null} when nothing was extracted
     * @return parsed fields; never {@code null}
     */
    public InvoiceFields parse(String rawText) {
        String baseCurrency = currencyNormalizer.baseCurrency();
        if (rawText == null) {
            return InvoiceFields.empty(baseCurrency);
        }

        String invoiceNumber = null;
        String invoiceDate = null;
        String currency = null;
        BigDecimal totalAmount = null;

        for (String line : LINE_BREAK.split(rawText)) {
            if (InvoiceVocabulary.containsLabel(line, InvoiceVocabulary.INVOICE_NUMBER_LABELS)) {
                invoiceNumber = valueAfterLastColon(line);
            }
            if (InvoiceVocabulary.containsLabel(line, InvoiceVocabulary.INVOICE_DATE_LABELS)) {
                invoiceDate = valueAfterLastColon(line);
            }
            if (InvoiceVocabulary.containsLabel(line, InvoiceVocabulary.TOTAL_LABELS)) {
                String[] tokens = WHITESPACE.split(line.strip());
                String lineCurrency = detectCurrency(tokens);
                if (lineCurrency != null) {
                    currency = lineCurrency;
                }
                BigDecimal lineAmount = detectAmount(tokens);
                if (lineAmount != null) {
                    totalAmount = lineAmount;
                }
            }
        }

        if (currency == null) {
            currency = baseCurrency;
        }
        String vendor = InvoiceVocabulary.findVendor(rawText);
        String vendorName = vendor != null ? vendor : InvoiceFields.UNKNOWN_VENDOR;

        BigDecimal fxRate = null;
        String fxRateDate = null;
        BigDecimal amountInBase = null;
        if (!currency.equals(baseCurrency) && totalAmount != null) {
            FxQuote quote = currencyNormalizer.rateToBase(currency);
            BigDecimal converted = quote.isAvailable() ? currencyNormalizer.convert(totalAmount, quote) : null;
            if (converted != null) {
                fxRate = quote.rate();
                fxRateDate = quote.asOf();
                amountInBase = converted;
            }
        }

        return new InvoiceFields(invoiceNumber, invoiceDate, vendorName, totalAmount, currency,
                fxRate, fxRateDate, amountInBase, rawText);
    }

    /**
     * Returns the text after the last ASCII or full-width colon, or the whole line when it has none.
     *
     * @param line labelled line
     * @return trimmed value, {@code null} when empty
     */
    private String valueAfterLastColon(String line) {
        int colon = Math.max(line.lastIndexOf(':'), line.lastIndexOf('：'));
        String value = (colon >= 0 ? line.substring(colon + 1) : line).strip();
        return value.isEmpty() ? null : value;
    }

    /**
     * An explicit USD marker wins over TWD markers on the same line.
     *
     * @param tokens whitespace separated tokens of a total line
     * @return detected currency code or {@code null}
     */
    private String detectCurrency(String[] tokens) {
        boolean twd = false;
        for (String token : tokens) {
            String upper = token.toUpperCase(Locale.ROOT);
            if (InvoiceVocabulary.USD_MARKERS.contains(upper)) {
                return "USD";
            }
            if (InvoiceVocabulary.TWD_MARKERS.contains(upper)) {
                twd = true;
            }
        }
        return twd ? "TWD" : null;
    }

    /**
     * Scans right to left for the first token that is a plain decimal once thousands separators are removed.
     * Exponent forms such as {@code 1e5} are not amounts.
     *
     * @param tokens whitespace separated tokens of a total line
     * @return parsed amount or {@code null}
     */
    private BigDecimal detectAmount(String[] tokens) {
        for (int i = tokens.length - 1; i >= 0; i--) {
            String candidate = tokens[i].replace(",", "");
            if (PLAIN_DECIMAL.matcher(candidate).matches()) {
                return new BigDecimal(candidate);
            }
        }
        return null;
    }
}
