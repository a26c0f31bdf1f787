package com.example.invoiceflow.application.exception;

/**
 * Wraps a failure raised while executing one workflow step. The run stops at that step.
 */
public class WorkflowExecutionException extends ApplicationException {

    private final String stepId;

	/**
	 * @param stepId id of the step that failed
	 * @param cause  exception raised by the step
	 */
    public WorkflowExecutionException(String stepId, Throwable cause) {
        super("Workflow step '" + stepId + "' failed: " + cause.getMessage(), cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
