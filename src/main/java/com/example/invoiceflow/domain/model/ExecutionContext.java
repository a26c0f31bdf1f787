package com.example.invoiceflow.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run state of a workflow execution. Created fresh for every run and filled in as steps execute.
 * Every encountered step id is recorded, whether or not the step did anything.
 */
public final class ExecutionContext {

    private final String workflow;
    private final WorkflowTask task;
    private final List<String> steps = new ArrayList<>();
    private InvoiceFields invoice;

    /**
     * @param workflow name of the running workflow
     * @param task     task payload, {@code null} treated as empty
     */
    public ExecutionContext(String workflow, WorkflowTask task) {
        this.workflow = workflow;
        this.task = task == null ? WorkflowTask.empty() : task;
    }

    public void recordStep(String stepId) {
        steps.add(stepId);
    }

    /**
     * Stores the fields parsed by a step, replacing the result of any earlier parse step.
     *
     * @param fields parsed invoice fields
     */
    public void recordInvoice(InvoiceFields fields) {
        this.invoice = fields;
    }

    public String getWorkflow() {
        return workflow;
    }

    public WorkflowTask getTask() {
        return task;
    }

    public List<String> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public InvoiceFields getInvoice() {
        return invoice;
    }
}
