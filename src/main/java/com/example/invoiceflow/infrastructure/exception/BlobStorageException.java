package com.example.invoiceflow.infrastructure.exception;

/**
 * Raised when a blob store cannot be read from or written to.
 */
public class BlobStorageException extends InfrastructureException {

    /**
     * Creates the exception for a store that failed to read or write an object.
     *
     * @param message which object could not be transferred
     * @param cause   client or filesystem failure
     */
    public BlobStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
