package com.example.invoiceflow.application.service;

import com.example.invoiceflow.domain.model.DocumentFormat;
import com.example.invoiceflow.domain.model.DocumentReference;
import com.example.invoiceflow.domain.model.ExtractionResult;
import com.example.invoiceflow.domain.port.BlobStore;
import com.example.invoiceflow.infrastructure.exception.BlobStorageException;
import com.example.invoiceflow.infrastructure.exception.DocumentExtractionException;
import com.example.invoiceflow.infrastructure.image.MachineReadableCodeReader;
import com.example.invoiceflow.infrastructure.pdf.PdfTextReader;
import com.example.invoiceflow.infrastructure.storage.TransientDocumentFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Application-layer service that turns a stored expense document into raw content.
 * PDFs yield their page text; images yield the payload of the first embedded code found.
 */
@Service
public class DocumentExtractionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentExtractionService.class);

    private final BlobStore blobStore;
    private final PdfTextReader pdfTextReader;
    private final MachineReadableCodeReader codeReader;

    /**
     * Creates the service with its storage and decoding collaborators.
     *
     * @param blobStore     store the documents are fetched from
     * @param pdfTextReader PDFBox-backed page text reader
     * @param codeReader    ZXing-backed code scanner
     */
    public DocumentExtractionService(BlobStore blobStore,
                                     PdfTextReader pdfTextReader,
                                     MachineReadableCodeReader codeReader) {
        this.blobStore = blobStore;
        this.pdfTextReader = pdfTextReader;
        this.codeReader = codeReader;
    }

    /**
     * Fetches the document once, materializes it to a temporary file and extracts its raw content.
     * The temporary file is removed before this method returns, whatever the outcome.
     *
     * @param reference document to extract
     * @return extraction result for the document
     * @throws com.example.invoiceflow.domain.exception.DocumentNotFoundException when the reference resolves to nothing
     * @throws DocumentExtractionException when the document cannot be fetched or decoded
     */
    public ExtractionResult extract(DocumentReference reference) {
        DocumentFormat format = reference.format();
        log.info("Extracting {} document {}", format, reference);

        byte[] content;
        try {
            content = blobStore.fetch(reference);
        } catch (BlobStorageException ex) {
            throw new DocumentExtractionException("Unable to fetch document " + reference, ex);
        }

        try (TransientDocumentFile file = TransientDocumentFile.materialize(content, reference.fileName())) {
            return switch (format) {
                case PDF -> extractPdf(reference, file);
                case IMAGE -> extractImage(reference, file);
            };
        } catch (IOException ex) {
            throw new DocumentExtractionException("Unable to read " + format + " document " + reference, ex);
        }
    }

    private ExtractionResult extractPdf(DocumentReference reference, TransientDocumentFile file) throws IOException {
        PdfTextReader.PdfPages pages = pdfTextReader.readPages(file.path());
        log.info("Extracted text from {} page(s) of {}", pages.pageCount(), reference);
        return ExtractionResult.ofPdfText(reference, pages.joinedText(), pages.pageCount());
    }

    private ExtractionResult extractImage(DocumentReference reference, TransientDocumentFile file) throws IOException {
        List<String> payloads = codeReader.decodeAll(file.path());
        if (payloads.isEmpty()) {
            log.info("No machine-readable code found in {}", reference);
            return ExtractionResult.ofNoCodeFound(reference);
        }
        if (payloads.size() > 1) {
            log.info("Found {} codes in {}; using the first decoded payload", payloads.size(), reference);
        }
        return ExtractionResult.ofDecodedPayload(reference, payloads.get(0));
    }
}
