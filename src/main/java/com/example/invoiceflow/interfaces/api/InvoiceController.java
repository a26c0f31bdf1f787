package com.example.invoiceflow.interfaces.api;

import com.example.invoiceflow.application.service.InvoiceExtractionService;
import com.example.invoiceflow.application.service.WorkflowService;
import com.example.invoiceflow.domain.exception.DocumentUriRequiredException;
import com.example.invoiceflow.domain.model.ExecutionContext;
import com.example.invoiceflow.domain.model.ExtractionResult;
import com.example.invoiceflow.domain.model.InvoiceFields;
import com.example.invoiceflow.interfaces.api.dto.DocumentRequest;
import com.example.invoiceflow.interfaces.api.dto.ParseRequest;
import com.example.invoiceflow.interfaces.api.dto.RunWorkflowRequest;
import com.example.invoiceflow.interfaces.api.dto.RunWorkflowResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Interfaces-layer REST controller exposing document extraction, invoice parsing and workflow runs.
 */
@RestController
public class InvoiceController {

    private final InvoiceExtractionService invoiceExtractionService;
    private final WorkflowService workflowService;

    /**
     * Creates the controller with the required application services.
     *
     * @param invoiceExtractionService single-document extraction and parsing
     * @param workflowService          workflow loading and execution
     */
    public InvoiceController(InvoiceExtractionService invoiceExtractionService, WorkflowService workflowService) {
        this.invoiceExtractionService = invoiceExtractionService;
        this.workflowService = workflowService;
    }

    /**
     * Extracts and parses one stored document.
     *
     * @param request body naming the document
     * @return parsed invoice fields
     */
    @PostMapping(value = "/api/invoices/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<InvoiceFields> extractAndParse(@RequestBody DocumentRequest request) {
        return ResponseEntity.ok(invoiceExtractionService.extractAndParse(documentUriOf(request)));
    }

    /**
     * Extracts raw content from one stored document without parsing it.
     *
     * @param request body naming the document
     * @return raw extraction result
     */
    @PostMapping(value = "/api/documents/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExtractionResult> extract(@RequestBody DocumentRequest request) {
        return ResponseEntity.ok(invoiceExtractionService.extract(documentUriOf(request)));
    }

    /**
     * Parses invoice fields from text the caller already has.
     *
     * @param request body carrying the text
     * @return parsed invoice fields
     */
    @PostMapping(value = "/api/invoices/parse", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<InvoiceFields> parse(@RequestBody ParseRequest request) {
        return ResponseEntity.ok(invoiceExtractionService.parse(request.rawText()));
    }

    /**
     * Runs a named workflow against the supplied task.
     *
     * @param request workflow name and task
     * @return step ids, echoed task and parsed invoice
     */
    @PostMapping(value = "/run-workflow", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RunWorkflowResponse> runWorkflow(@RequestBody RunWorkflowRequest request) {
        ExecutionContext context = workflowService.run(request.workflow(), request.task());
        return ResponseEntity.ok(RunWorkflowResponse.from(context));
    }

    private String documentUriOf(DocumentRequest request) {
        if (request == null || request.documentUri() == null) {
            throw new DocumentUriRequiredException();
        }
        return request.documentUri();
    }
}
