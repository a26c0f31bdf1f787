package com.example.invoiceflow.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lookup tables used by the invoice field parser: label tokens per field, currency markers and known vendors.
 * English labels are matched ignoring case; Chinese labels are matched as-is.
 */
public final class InvoiceVocabulary {

    public static final List<String> INVOICE_NUMBER_LABELS = List.of(
            "invoice no",
            "invoice number",
            "invoice #",
            "發票號碼",
            "發票號"
    );

    public static final List<String> INVOICE_DATE_LABELS = List.of(
            "invoice date",
            "發票日期"
    );

    public static final List<String> TOTAL_LABELS = List.of(
            "total",
            "總計",
            "合計"
    );

    public static final Set<String> USD_MARKERS = Set.of("USD", "US$");

    public static final Set<String> TWD_MARKERS = Set.of("TWD", "NTD", "NT$", "NT", "元");

    /**
     * Lower-case name fragment to vendor display name. Iteration order decides which vendor wins
     * when several fragments occur in the same text.
     */
    public static final Map<String, String> VENDORS;

    static {
        Map<String, String> vendors = new LinkedHashMap<>();
        vendors.put("amazon web services", "Amazon Web Services");
        vendors.put("amazon", "Amazon");
        vendors.put("google", "Google");
        vendors.put("microsoft", "Microsoft");
        vendors.put("openai", "OpenAI");
        vendors.put("github", "GitHub");
        vendors.put("uber", "Uber");
        vendors.put("starbucks", "Starbucks");
        vendors.put("7-eleven", "7-ELEVEN");
        vendors.put("統一超商", "7-ELEVEN");
        vendors.put("全家", "FamilyMart");
        vendors.put("familymart", "FamilyMart");
        vendors.put("中華電信", "Chunghwa Telecom");
        VENDORS = Collections.unmodifiableMap(vendors);
    }

    private InvoiceVocabulary() {
    }

    /**
     * @param line   line to inspect
     * @param labels label tokens of one field
     * @return {@code true} when the line contains any of the labels
     */
    public static boolean containsLabel(String line, List<String> labels) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String label : labels) {
            if (lower.contains(label)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param text full document text
     * @return display name of the first known vendor whose fragment occurs in the text, or {@code null}
     */
    public static String findVendor(String text) {
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> vendor : VENDORS.entrySet()) {
            if (lower.contains(vendor.getKey())) {
                return vendor.getValue();
            }
        }
        return null;
    }
}
