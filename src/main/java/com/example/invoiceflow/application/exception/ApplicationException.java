package com.example.invoiceflow.application.exception;

/**
 * Base unchecked exception for use-case failures that are neither bad input nor a broken adapter,
 * such as a workflow run that stopped part way.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * Creates a new application-layer exception that wraps the failure it reports.
	 *
	 * @param message description surfaced to the caller
	 * @param cause   exception raised while running the use case
	 */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
