package com.example.invoiceflow.interfaces.api.dto;

/**
 * Request body carrying already extracted text.
 *
 * @param rawText text to parse; {@code null} yields an all-default result
 */
public record ParseRequest(String rawText) {
}
