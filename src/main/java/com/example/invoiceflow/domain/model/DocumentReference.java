package com.example.invoiceflow.domain.model;

import com.example.invoiceflow.domain.exception.InvalidDocumentReferenceException;

import java.util.Locale;

/**
 * Locator of a single document inside a remote blob store, written as {@code scheme://container/path}.
 * The document format is derived from the trailing extension of {@link #path()} only.
 */
public record DocumentReference(
        String scheme,
        String container,
        String path
) {

    private static final String SCHEME_SEPARATOR = "://";

    /**
     * Parses a {@code scheme://container/path} string.
     *
     * @param uri raw document URI supplied by the caller
     * @return parsed reference
     * @throws InvalidDocumentReferenceException when the scheme, container or path is missing
     */
    public static DocumentReference parse(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new InvalidDocumentReferenceException(uri, "document URI is empty");
        }
        String trimmed = uri.trim();
        int schemeEnd = trimmed.indexOf(SCHEME_SEPARATOR);
        if (schemeEnd <= 0) {
            throw new InvalidDocumentReferenceException(trimmed, "missing scheme prefix");
        }
        String scheme = trimmed.substring(0, schemeEnd);
        String remainder = trimmed.substring(schemeEnd + SCHEME_SEPARATOR.length());
        int containerEnd = remainder.indexOf('/');
        if (containerEnd <= 0) {
            throw new InvalidDocumentReferenceException(trimmed, "missing container");
        }
        String container = remainder.substring(0, containerEnd);
        String path = remainder.substring(containerEnd + 1);
        if (path.isBlank()) {
            throw new InvalidDocumentReferenceException(trimmed, "missing object path");
        }
        return new DocumentReference(scheme.toLowerCase(Locale.ROOT), container, path);
    }

    /**
     * @return format inferred from the path extension
     */
    public DocumentFormat format() {
        return DocumentFormat.fromPath(path);
    }

    /**
     * @return file name portion of the path (the text after the last {@code /})
     */
    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * @return canonical {@code scheme://container/path} representation
     */
    public String toUri() {
        return scheme + SCHEME_SEPARATOR + container + "/" + path;
    }

    @Override
    public String toString() {
        return toUri();
    }
}
