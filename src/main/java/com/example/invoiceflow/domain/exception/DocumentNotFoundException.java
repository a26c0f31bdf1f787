package com.example.invoiceflow.domain.exception;

/**
 * Raised when a well-formed document reference does not resolve to any object in the blob store.
 */
public class DocumentNotFoundException extends DomainException {

    /**
     * @param uri locator that resolved to no stored object
     */
    public DocumentNotFoundException(String uri) {
        super("Document not found: " + uri);
    }
}
