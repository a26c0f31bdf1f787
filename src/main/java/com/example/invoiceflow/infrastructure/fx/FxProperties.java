package com.example.invoiceflow.infrastructure.fx;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Exchange-rate settings bound from {@code invoice.fx.*}. Immutable once bound.
 *
 * @param baseUrl      root URL of the exchangerate-api v6 endpoint
 * @param apiKey       API key placed in the request path
 * @param timeout      connect and read timeout of a single lookup
 * @param baseCurrency currency every foreign amount is normalized to
 */
@ConfigurationProperties(prefix = "invoice.fx")
public record FxProperties(
        @DefaultValue("https://v6.exchangerate-api.com/v6") String baseUrl,
        String apiKey,
        @DefaultValue("5s") Duration timeout,
        @DefaultValue("TWD") String baseCurrency
) {
}
