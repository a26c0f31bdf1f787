package com.example.invoiceflow.infrastructure.exception;

/**
 * Signals that a document could not be fetched or decoded into raw content.
 */
public class DocumentExtractionException extends InfrastructureException {

	/**
	 * Creates the exception with a contextual message and the root cause from storage, PDFBox or ImageIO.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level exception
	 */
    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
