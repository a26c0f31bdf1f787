package com.example.invoiceflow.infrastructure.storage;

import com.example.invoiceflow.domain.exception.DocumentNotFoundException;
import com.example.invoiceflow.domain.model.DocumentReference;
import com.example.invoiceflow.domain.port.BlobStore;
import com.example.invoiceflow.infrastructure.exception.BlobStorageException;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Google Cloud Storage adapter serving {@code gs://bucket/object} references.
 */
public class GcsBlobStore implements BlobStore {

    static final String SCHEME = "gs";

    private static final Logger log = LoggerFactory.getLogger(GcsBlobStore.class);

    private final Storage storage;

    /**
     * @param storage authenticated Cloud Storage client
     */
    public GcsBlobStore(Storage storage) {
        this.storage = storage;
    }

    @Override
    public boolean supports(String scheme) {
        return SCHEME.equals(scheme);
    }

    @Override
    public byte[] fetch(DocumentReference reference) {
        try {
            Blob blob = storage.get(BlobId.of(reference.container(), reference.path()));
            if (blob == null) {
                log.warn("Blob not found for {}", reference.toUri());
                throw new DocumentNotFoundException(reference.toUri());
            }
            return blob.getContent();
        } catch (StorageException ex) {
            throw new BlobStorageException("Unable to download " + reference.toUri(), ex);
        }
    }

    @Override
    public DocumentReference store(DocumentReference reference, byte[] content, String contentType) {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(reference.container(), reference.path()))
                .setContentType(contentType)
                .build();
        try {
            storage.create(blobInfo, content);
        } catch (StorageException ex) {
            throw new BlobStorageException("Unable to upload " + reference.toUri(), ex);
        }
        log.info("Uploaded {} bytes to {}", content.length, reference.toUri());
        return reference;
    }
}
