package com.example.invoiceflow.infrastructure.fx;

import com.example.invoiceflow.domain.model.RateTable;
import com.example.invoiceflow.domain.port.RateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link RateService} backed by the exchangerate-api v6 REST endpoint.
 * Single attempt per call; timeouts come from the request factory configured in {@link FxConfig}.
 */
public class ExchangeRateApiClient implements RateService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRateApiClient.class);

    private final RestClient restClient;
    private final FxProperties properties;

    /**
     * Creates the client over a {@link RestClient} already bound to the service base URL.
     *
     * @param restClient client with base URL and timeouts applied
     * @param properties FX settings carrying the API key
     */
    public ExchangeRateApiClient(RestClient restClient, FxProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public RateTable latestRates(String baseCurrency) {
        if (!StringUtils.hasText(properties.apiKey())) {
            throw new RateLookupException("invoice.fx.api-key is not configured");
        }

        ExchangeRateApiResponse response;
        try {
            response = restClient.get()
                    .uri("/{apiKey}/latest/{currency}", properties.apiKey(), baseCurrency)
                    .retrieve()
                    .body(ExchangeRateApiResponse.class);
        } catch (RestClientException ex) {
            throw new RateLookupException("Rate lookup for " + baseCurrency + " failed", ex);
        }

        if (response == null) {
            throw new RateLookupException("Rate service returned an empty body for " + baseCurrency);
        }
        if (!response.isSuccess()) {
            throw new RateLookupException("Rate service answered " + response.result() + " ("
                    + response.errorType() + ") for " + baseCurrency);
        }

        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        if (response.conversionRates() != null) {
            response.conversionRates().forEach((currency, rate) -> {
                if (currency != null && rate != null) {
                    rates.put(currency, rate);
                }
            });
        }
        log.debug("Fetched {} rates anchored at {} (as of {})", rates.size(), response.baseCode(),
                response.timeLastUpdateUtc());
        String anchor = StringUtils.hasText(response.baseCode()) ? response.baseCode() : baseCurrency;
        return new RateTable(anchor, response.timeLastUpdateUtc(), rates);
    }
}
