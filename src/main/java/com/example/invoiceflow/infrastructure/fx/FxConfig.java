package com.example.invoiceflow.infrastructure.fx;

import com.example.invoiceflow.domain.port.RateService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Builds the rate-service client with bounded connect and read timeouts.
 */
@Configuration
@EnableConfigurationProperties(FxProperties.class)
public class FxConfig {

    @Bean
    @ConditionalOnMissingBean(RateService.class)
    public RateService rateService(RestClient.Builder restClientBuilder, FxProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.timeout());
        requestFactory.setReadTimeout(properties.timeout());

        RestClient restClient = restClientBuilder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .build();
        return new ExchangeRateApiClient(restClient, properties);
    }
}
