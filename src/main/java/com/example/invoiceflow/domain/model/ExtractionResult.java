package com.example.invoiceflow.domain.model;

import java.util.List;

/**
 * Raw content pulled out of one document, handed to the field parser.
 * PDFs populate {@code rawText} with the joined page text; images populate both {@code rawText}
 * and {@code decodedPayload} with the first decoded code, or leave both empty when no code was found.
 */
public record ExtractionResult(
        String rawText,
        String decodedPayload,
        List<InvoiceLineItem> items,
        DocumentReference source,
        String note,
        int pageCount
) {

    public ExtractionResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Builds the result of the PDF path.
     *
     * @param source    document the text came from
     * @param rawText   page texts joined by newlines
     * @param pageCount number of pages in the document
     * @return populated result without a decoded payload
     */
    public static ExtractionResult ofPdfText(DocumentReference source, String rawText, int pageCount) {
        return new ExtractionResult(rawText, null, List.of(), source,
                "Text extracted from PDF; invoice fields are parsed in a separate step.", pageCount);
    }

    /**
     * Builds the result of the image path when a code was decoded.
     *
     * @param source  document the payload came from
     * @param payload first decoded payload
     * @return populated result
     */
    public static ExtractionResult ofDecodedPayload(DocumentReference source, String payload) {
        return new ExtractionResult(payload, payload, List.of(), source, null, 1);
    }

    /**
     * Builds the result of the image path when the image carries no decodable code.
     *
     * @param source scanned document
     * @return result with empty text
     */
    public static ExtractionResult ofNoCodeFound(DocumentReference source) {
        return new ExtractionResult(null, null, List.of(), source, "No machine-readable code found in image.", 1);
    }
}
