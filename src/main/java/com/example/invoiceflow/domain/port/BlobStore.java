package com.example.invoiceflow.domain.port;

import com.example.invoiceflow.domain.model.DocumentReference;

/**
 * Remote blob store holding expense documents.
 */
public interface BlobStore {

    /**
     * Downloads the full content of a document.
     *
     * @param reference document locator
     * @return document bytes
     * @throws com.example.invoiceflow.domain.exception.DocumentNotFoundException when nothing exists at the reference
     * @throws com.example.invoiceflow.infrastructure.exception.BlobStorageException when the store cannot be reached
     */
    byte[] fetch(DocumentReference reference);

    /**
     * Uploads content to the given location, replacing any existing object.
     *
     * @param reference   target locator
     * @param content     bytes to write
     * @param contentType MIME type recorded with the object (may be {@code null})
     * @return locator of the stored object
     */
    DocumentReference store(DocumentReference reference, byte[] content, String contentType);

    /**
     * @param scheme URI scheme of a reference
     * @return {@code true} when this store serves references with that scheme
     */
    boolean supports(String scheme);
}
