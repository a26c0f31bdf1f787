package com.example.invoiceflow.infrastructure.storage;

import com.example.invoiceflow.domain.exception.DocumentNotFoundException;
import com.example.invoiceflow.domain.exception.InvalidDocumentReferenceException;
import com.example.invoiceflow.domain.model.DocumentReference;
import com.example.invoiceflow.domain.port.BlobStore;
import com.example.invoiceflow.infrastructure.exception.BlobStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem-backed blob store used for local runs. {@code scheme://container/path} maps to
 * {@code <root>/container/path}; every scheme except {@code gs} is served.
 */
public class LocalBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalBlobStore.class);

    private final Path root;

    /**
     * @param root directory holding one sub directory per container
     */
    public LocalBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public boolean supports(String scheme) {
        return !GcsBlobStore.SCHEME.equals(scheme);
    }

    @Override
    public byte[] fetch(DocumentReference reference) {
        Path file = resolve(reference);
        if (!Files.isRegularFile(file)) {
            throw new DocumentNotFoundException(reference.toUri());
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new BlobStorageException("Unable to read " + reference.toUri(), ex);
        }
    }

    @Override
    public DocumentReference store(DocumentReference reference, byte[] content, String contentType) {
        Path file = resolve(reference);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, content);
        } catch (IOException ex) {
            throw new BlobStorageException("Unable to write " + reference.toUri(), ex);
        }
        log.info("Stored {} bytes ({}) at {}", content.length, contentType, reference.toUri());
        return reference;
    }

    /**
     * Maps the reference below the root. The container must be a single directory name and the
     * normalized file must stay inside both the root and that container.
     */
    private Path resolve(DocumentReference reference) {
        String container = reference.container();
        if (".".equals(container) || "..".equals(container)
                || container.contains("/") || container.contains("\\")) {
            throw new InvalidDocumentReferenceException(reference.toUri(), "invalid container name");
        }
        Path containerDir = root.resolve(container).normalize();
        Path file = containerDir.resolve(reference.path()).normalize();
        if (!containerDir.startsWith(root) || !file.startsWith(containerDir) || file.equals(containerDir)) {
            throw new InvalidDocumentReferenceException(reference.toUri(), "path escapes its container");
        }
        return file;
    }
}
