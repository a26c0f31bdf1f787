package com.example.invoiceflow.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Cross-origin settings bound from {@code invoice.cors.*}.
 *
 * @param allowedOrigins origins allowed to call the API; {@code *} allows any origin
 */
@ConfigurationProperties(prefix = "invoice.cors")
public record CorsProperties(
        @DefaultValue("*") List<String> allowedOrigins
) {
}
