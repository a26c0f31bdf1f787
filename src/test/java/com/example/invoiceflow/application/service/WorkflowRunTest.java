package com.example.invoiceflow.application.service;

import com.example.invoiceflow.domain.model.DocumentReference;
import com.example.invoiceflow.domain.model.ExecutionContext;
import com.example.invoiceflow.domain.model.InvoiceFields;
import com.example.invoiceflow.domain.model.RateTable;
import com.example.invoiceflow.domain.model.WorkflowTask;
import com.example.invoiceflow.domain.port.BlobStore;
import com.example.invoiceflow.domain.port.RateService;
import com.example.invoiceflow.infrastructure.fx.FxProperties;
import com.example.invoiceflow.infrastructure.image.MachineReadableCodeReader;
import com.example.invoiceflow.infrastructure.pdf.PdfTextReader;
import com.example.invoiceflow.infrastructure.workflow.JsonWorkflowDefinitionSource;
import com.example.invoiceflow.infrastructure.workflow.WorkflowProperties;
import com.example.invoiceflow.support.TestDocuments;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Runs workflows loaded from classpath definitions through the real extractor, parser and normalizer,
 * with only the blob store and the rate service mocked.
 */
class WorkflowRunTest {

    private BlobStore blobStore;
    private RateService rateService;
    private WorkflowService workflowService;

    @BeforeEach
    void setUp() {
        blobStore = mock(BlobStore.class);
        rateService = mock(RateService.class);
        FxProperties properties = new FxProperties("http://rates.test", "key", Duration.ofSeconds(5), "TWD");
        InvoiceExtractionService extractionService = new InvoiceExtractionService(
                new DocumentExtractionService(blobStore, new PdfTextReader(), new MachineReadableCodeReader()),
                new InvoiceFieldParser(new CurrencyNormalizer(rateService, properties)));
        JsonWorkflowDefinitionSource definitionSource = new JsonWorkflowDefinitionSource(
                new DefaultResourceLoader(), new ObjectMapper(), new WorkflowProperties("classpath:workflow/"));
        workflowService = new WorkflowService(definitionSource, new WorkflowExecutor(extractionService));
    }

    /**
     * A USD invoice PDF named by the task is parsed and normalized at 32.0 to TWD.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void expenseIntakeParsesAndNormalizesTaskDocument() throws Exception {
        given(blobStore.fetch(DocumentReference.parse("store://bucket/invoice.pdf")))
                .willReturn(TestDocuments.singlePagePdf("Total: USD 49.99", "Invoice #: INV-1"));
        given(rateService.latestRates("USD"))
                .willReturn(new RateTable("USD", "2024-01-01", Map.of("TWD", new BigDecimal("32.0"))));

        ExecutionContext context = workflowService.run("expense_intake",
                WorkflowTask.ofDocument("store://bucket/invoice.pdf"));

        assertThat(context.getSteps()).containsExactly("parse_invoice_input", "classify_expense", "submit_for_approval");
        InvoiceFields invoice = context.getInvoice();
        assertThat(invoice.invoiceNumber()).isEqualTo("INV-1");
        assertThat(invoice.totalAmount()).isEqualByComparingTo("49.99");
        assertThat(invoice.currency()).isEqualTo("USD");
        assertThat(invoice.fxRate()).isEqualByComparingTo("32.0");
        assertThat(invoice.fxRateDate()).isEqualTo("2024-01-01");
        assertThat(invoice.amountInBaseCurrency()).isEqualTo(new BigDecimal("1599.68"));
        assertThat(invoice.vendorName()).isEqualTo(InvoiceFields.UNKNOWN_VENDOR);
    }

    /**
     * Without a document every step is still recorded, and nothing is fetched or parsed.
     */
    @Test
    void stepsAroundParseAreRecordedWhenTaskHasNoDocument() {
        ExecutionContext context = workflowService.run("skip_around_parse", WorkflowTask.empty());

        assertThat(context.getWorkflow()).isEqualTo("skip_around_parse");
        assertThat(context.getSteps()).containsExactly("noop_a", "parse_invoice_input", "noop_b");
        assertThat(context.getInvoice()).isNull();
        verifyNoInteractions(blobStore, rateService);
    }
}
