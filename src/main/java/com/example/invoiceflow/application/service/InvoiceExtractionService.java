package com.example.invoiceflow.application.service;

import com.example.invoiceflow.domain.exception.DocumentUriRequiredException;
import com.example.invoiceflow.domain.model.DocumentReference;
import com.example.invoiceflow.domain.model.ExtractionResult;
import com.example.invoiceflow.domain.model.InvoiceFields;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single-document entry point: extract raw content, then parse invoice fields from it.
 */
@Service
public class InvoiceExtractionService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceExtractionService.class);

    private final DocumentExtractionService extractionService;
    private final InvoiceFieldParser fieldParser;

    /**
     * @param extractionService raw content extractor
     * @param fieldParser       parser applied to the extracted text
     */
    public InvoiceExtractionService(DocumentExtractionService extractionService, InvoiceFieldParser fieldParser) {
        this.extractionService = extractionService;
        this.fieldParser = fieldParser;
    }

    /**
     * Extracts raw content from the document at {@code documentUri} without parsing it.
     *
     * @param documentUri {@code scheme://container/path} locator
     * @return raw extraction result
     */
    public ExtractionResult extract(String documentUri) {
        return extractionService.extract(toReference(documentUri));
    }

    /**
     * Extracts and parses the document at {@code documentUri}.
     *
     * @param documentUri {@code scheme://container/path} locator
     * @return parsed invoice fields; unknown fields stay {@code null}
     */
    public InvoiceFields extractAndParse(String documentUri) {
        DocumentReference reference = toReference(documentUri);
        ExtractionResult extraction = extractionService.extract(reference);
        InvoiceFields fields = fieldParser.parse(extraction.rawText());
        log.info("Parsed {}: invoice={}, total={} {}, normalized={}", reference, fields.invoiceNumber(),
                fields.totalAmount(), fields.currency(), fields.isNormalized());
        return fields;
    }

    /**
     * @param rawText already extracted text
     * @return parsed invoice fields
     */
    public InvoiceFields parse(String rawText) {
        return fieldParser.parse(rawText);
    }

    private DocumentReference toReference(String documentUri) {
        if (documentUri == null || documentUri.isBlank()) {
            throw new DocumentUriRequiredException();
        }
        return DocumentReference.parse(documentUri);
    }
}
