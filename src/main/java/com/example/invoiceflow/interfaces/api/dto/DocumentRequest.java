package com.example.invoiceflow.interfaces.api.dto;

/**
 * Request body naming one stored document.
 *
 * @param documentUri {@code scheme://container/path} locator
 */
public record DocumentRequest(String documentUri) {
}
