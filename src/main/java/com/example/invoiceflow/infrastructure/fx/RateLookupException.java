package com.example.invoiceflow.infrastructure.fx;

import com.example.invoiceflow.infrastructure.exception.InfrastructureException;

/**
 * Raised by the rate client when the service answers with an error or an unusable payload.
 * The currency normalizer folds it into an unavailable quote.
 */
public class RateLookupException extends InfrastructureException {

    /**
     * @param message why no rate table could be produced
     */
    public RateLookupException(String message) {
        super(message, null);
    }

    /**
     * @param message why no rate table could be produced
     * @param cause   HTTP client failure
     */
    public RateLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
