package com.example.invoiceflow.domain.port;

import com.example.invoiceflow.domain.model.RateTable;

/**
 * External exchange-rate service.
 */
public interface RateService {

    /**
     * Fetches the latest rate table anchored at {@code baseCurrency}.
     *
     * @param baseCurrency ISO code the returned rates are quoted against
     * @return full rate table
     */
    RateTable latestRates(String baseCurrency);
}
