package com.example.invoiceflow.domain.exception;

/**
 * Raised when a workflow run is requested without a workflow name.
 */
public class WorkflowNameRequiredException extends DomainException {

    /**
     * Creates the exception raised when a run names no workflow.
     */
    public WorkflowNameRequiredException() {
        super("workflow is required");
    }
}
