package com.example.invoiceflow.infrastructure.fx;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Wire format of the exchangerate-api {@code /latest/{currency}} response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExchangeRateApiResponse(
        String result,
        @JsonProperty("error-type") String errorType,
        @JsonProperty("base_code") String baseCode,
        @JsonProperty("time_last_update_utc") String timeLastUpdateUtc,
        @JsonProperty("conversion_rates") Map<String, BigDecimal> conversionRates
) {

    static final String SUCCESS = "success";

    boolean isSuccess() {
        return SUCCESS.equals(result);
    }
}
