package com.example.invoiceflow.infrastructure.storage;

import com.example.invoiceflow.domain.exception.InvalidDocumentReferenceException;
import com.example.invoiceflow.domain.model.DocumentReference;
import com.example.invoiceflow.domain.port.BlobStore;

import java.util.List;

/**
 * Dispatches each reference to the first configured store that serves its scheme.
 */
public class RoutingBlobStore implements BlobStore {

    private final List<BlobStore> stores;

    /**
     * @param stores candidate stores in priority order
     */
    public RoutingBlobStore(List<BlobStore> stores) {
        this.stores = List.copyOf(stores);
    }

    @Override
    public boolean supports(String scheme) {
        return stores.stream().anyMatch(store -> store.supports(scheme));
    }

    @Override
    public byte[] fetch(DocumentReference reference) {
        return route(reference).fetch(reference);
    }

    @Override
    public DocumentReference store(DocumentReference reference, byte[] content, String contentType) {
        return route(reference).store(reference, content, contentType);
    }

    private BlobStore route(DocumentReference reference) {
        return stores.stream()
                .filter(store -> store.supports(reference.scheme()))
                .findFirst()
                .orElseThrow(() -> new InvalidDocumentReferenceException(reference.toUri(),
                        "no blob store configured for scheme '" + reference.scheme() + "'"));
    }
}
