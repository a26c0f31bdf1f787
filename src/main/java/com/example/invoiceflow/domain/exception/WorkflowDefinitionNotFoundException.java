package com.example.invoiceflow.domain.exception;

/**
 * Raised when no workflow definition is registered under the requested name.
 */
public class WorkflowDefinitionNotFoundException extends DomainException {

    private final String workflowName;

	/**
	 * @param workflowName name that could not be resolved
	 */
    public WorkflowDefinitionNotFoundException(String workflowName) {
        super("Workflow definition not found: " + workflowName);
        this.workflowName = workflowName;
    }

	/**
	 * @param workflowName name that could not be resolved
	 * @param cause        error raised while reading or parsing the definition
	 */
    public WorkflowDefinitionNotFoundException(String workflowName, Throwable cause) {
        super("Workflow definition could not be loaded: " + workflowName, cause);
        this.workflowName = workflowName;
    }

    public String getWorkflowName() {
        return workflowName;
    }
}
