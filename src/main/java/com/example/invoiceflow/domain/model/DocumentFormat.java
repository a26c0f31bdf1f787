package com.example.invoiceflow.domain.model;

import java.util.Locale;

/**
 * Extraction path chosen for a document. Anything that is not a PDF is treated as raster imagery.
 */
public enum DocumentFormat {
    PDF,
    IMAGE;

    /**
     * Resolves the format from a path's trailing extension, ignoring case.
     *
     * @param path object path or file name
     * @return {@link #PDF} for {@code .pdf} paths, otherwise {@link #IMAGE}
     */
    public static DocumentFormat fromPath(String path) {
        if (path != null && path.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return PDF;
        }
        return IMAGE;
    }
}
