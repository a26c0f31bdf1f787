package com.example.invoiceflow.infrastructure.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Temporary local copy of a fetched document. The file is deleted on {@link #close()},
 * so callers hold it in a try-with-resources block scoped to a single extraction.
 */
public final class TransientDocumentFile implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransientDocumentFile.class);
    private static final String PREFIX = "invoice-doc-";

    private final Path path;

    private TransientDocumentFile(Path path) {
        this.path = path;
    }

    /**
     * Writes the bytes to a new uniquely named file in the JVM temp directory.
     *
     * @param content  document bytes
     * @param fileName original file name, used only for its extension
     * @return handle owning the temporary file
     * @throws IOException when the file cannot be created or written
     */
    public static TransientDocumentFile materialize(byte[] content, String fileName) throws IOException {
        Path file = Files.createTempFile(PREFIX, suffixOf(fileName));
        try {
            Files.write(file, content);
        } catch (IOException ex) {
            Files.deleteIfExists(file);
            throw ex;
        }
        return new TransientDocumentFile(file);
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Failed to delete transient document file {}", path, ex);
        }
    }

    private static String suffixOf(String fileName) {
        if (fileName == null) {
            return ".tmp";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return ".tmp";
        }
        String extension = fileName.substring(dot);
        return extension.matches("\\.[A-Za-z0-9]{1,8}") ? extension : ".tmp";
    }
}
