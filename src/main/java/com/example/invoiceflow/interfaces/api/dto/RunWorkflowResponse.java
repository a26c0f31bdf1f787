package com.example.invoiceflow.interfaces.api.dto;

import com.example.invoiceflow.domain.model.ExecutionContext;
import com.example.invoiceflow.domain.model.InvoiceFields;
import com.example.invoiceflow.domain.model.WorkflowTask;

import java.util.List;

/**
 * Response of a workflow run: every step id in definition order, the echoed task and the parsed invoice.
 */
public record RunWorkflowResponse(
        String workflow,
        List<String> steps,
        WorkflowTask task,
        InvoiceFields invoice
) {

    public static RunWorkflowResponse from(ExecutionContext context) {
        return new RunWorkflowResponse(context.getWorkflow(), context.getSteps(), context.getTask(), context.getInvoice());
    }
}
