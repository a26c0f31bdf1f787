package com.example.invoiceflow.domain.exception;

/**
 * Base type for failures caused by the caller's input: malformed document locators, missing fields,
 * or names and documents that resolve to nothing. The API layer answers these with 4xx statuses.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message what was wrong with the input
	 */
    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
