package com.example.invoiceflow.application.service;

import com.example.invoiceflow.application.exception.WorkflowExecutionException;
import com.example.invoiceflow.domain.model.ExecutionContext;
import com.example.invoiceflow.domain.model.InvoiceFields;
import com.example.invoiceflow.domain.model.WorkflowDefinition;
import com.example.invoiceflow.domain.model.WorkflowStep;
import com.example.invoiceflow.domain.model.WorkflowTask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the steps of a workflow definition in order against one task.
 * Only {@value #PARSE_INVOICE_INPUT} does work; any other step id is recorded and skipped.
 */
@Service
public class WorkflowExecutor {

    public static final String PARSE_INVOICE_INPUT = "parse_invoice_input";

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    private final InvoiceExtractionService invoiceExtractionService;

    /**
     * Creates the executor with the service backing the parse step.
     *
     * @param invoiceExtractionService extract-and-parse entry point used by {@value #PARSE_INVOICE_INPUT}
     */
    public WorkflowExecutor(InvoiceExtractionService invoiceExtractionService) {
        this.invoiceExtractionService = invoiceExtractionService;
    }

    /**
     * Executes the definition. A repeated parse step overwrites the invoice of the previous one; the
     * k-th parse step reads the k-th entry of {@code task.documents} and falls back to {@code task.document}.
     *
     * @param definition workflow to run
     * @param task       task payload
     * @return context holding every encountered step id and the last parsed invoice
     * @throws WorkflowExecutionException when a step fails; later steps are not run
     */
    public ExecutionContext execute(WorkflowDefinition definition, WorkflowTask task) {
        ExecutionContext context = new ExecutionContext(definition.name(), task);
        int parseOccurrence = 0;

        for (WorkflowStep step : definition.steps()) {
            String stepId = step.id();
            context.recordStep(stepId);
            if (!PARSE_INVOICE_INPUT.equals(stepId)) {
                log.debug("Workflow {}: step '{}' has no handler, skipping", definition.name(), stepId);
                continue;
            }

            String documentUri = context.getTask().documentFor(parseOccurrence++);
            if (documentUri == null) {
                log.info("Workflow {}: step '{}' found no document reference in the task", definition.name(), stepId);
                continue;
            }
            try {
                InvoiceFields fields = invoiceExtractionService.extractAndParse(documentUri);
                context.recordInvoice(fields);
            } catch (RuntimeException ex) {
                log.error("Workflow {}: step '{}' failed for {}", definition.name(), stepId, documentUri, ex);
                throw new WorkflowExecutionException(stepId, ex);
            }
        }
        return context;
    }
}
