package com.example.invoiceflow.domain.exception;

/**
 * Raised when a request asks for extraction without naming a document.
 */
public class DocumentUriRequiredException extends DomainException {

	/**
	 * Creates the exception with a predefined error message.
	 */
    public DocumentUriRequiredException() {
        super("documentUri is required.");
    }
}
