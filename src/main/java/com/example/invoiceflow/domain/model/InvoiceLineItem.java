package com.example.invoiceflow.domain.model;

import java.math.BigDecimal;

/**
 * Single itemized invoice line. Extraction does not itemize documents yet, so result lists stay empty.
 */
public record InvoiceLineItem(
        String description,
        BigDecimal amount
) {
}
