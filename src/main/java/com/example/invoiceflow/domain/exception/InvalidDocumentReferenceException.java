package com.example.invoiceflow.domain.exception;

/**
 * Raised when a document URI is not of the form {@code scheme://container/path}
 * or uses a scheme no configured blob store serves.
 */
public class InvalidDocumentReferenceException extends DomainException {

	/**
	 * @param uri    offending URI as supplied by the caller
	 * @param reason short description of what is wrong with it
	 */
    public InvalidDocumentReferenceException(String uri, String reason) {
        super("Invalid document reference '" + uri + "': " + reason);
    }
}
