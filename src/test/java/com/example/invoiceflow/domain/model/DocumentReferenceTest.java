package com.example.invoiceflow.domain.model;

import com.example.invoiceflow.domain.exception.InvalidDocumentReferenceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for parsing document locators.
 */
class DocumentReferenceTest {

    /**
     * Verifies that scheme, container and nested path are split at the first separators.
     */
    @Test
    void parseSplitsSchemeContainerAndPath() {
        DocumentReference reference = DocumentReference.parse("GS://receipts/2024/03/invoice.PDF");

        assertThat(reference.scheme()).isEqualTo("gs");
        assertThat(reference.container()).isEqualTo("receipts");
        assertThat(reference.path()).isEqualTo("2024/03/invoice.PDF");
        assertThat(reference.fileName()).isEqualTo("invoice.PDF");
        assertThat(reference.toUri()).isEqualTo("gs://receipts/2024/03/invoice.PDF");
    }

    /**
     * The format only depends on the trailing extension, ignoring case.
     */
    @Test
    void formatFollowsTrailingExtension() {
        assertThat(DocumentReference.parse("gs://b/a.pdf").format()).isEqualTo(DocumentFormat.PDF);
        assertThat(DocumentReference.parse("gs://b/A.Pdf").format()).isEqualTo(DocumentFormat.PDF);
        assertThat(DocumentReference.parse("gs://b/receipt.png").format()).isEqualTo(DocumentFormat.IMAGE);
        assertThat(DocumentReference.parse("gs://b/report.pdf.jpg").format()).isEqualTo(DocumentFormat.IMAGE);
        assertThat(DocumentReference.parse("gs://b/no-extension").format()).isEqualTo(DocumentFormat.IMAGE);
    }

    @Test
    void parseRejectsMalformedLocators() {
        assertThrows(InvalidDocumentReferenceException.class, () -> DocumentReference.parse(null));
        assertThrows(InvalidDocumentReferenceException.class, () -> DocumentReference.parse("  "));
        assertThrows(InvalidDocumentReferenceException.class, () -> DocumentReference.parse("bucket/file.pdf"));
        assertThrows(InvalidDocumentReferenceException.class, () -> DocumentReference.parse("gs://bucket"));
        assertThrows(InvalidDocumentReferenceException.class, () -> DocumentReference.parse("gs:///file.pdf"));
        assertThrows(InvalidDocumentReferenceException.class, () -> DocumentReference.parse("gs://bucket/"));
    }
}
