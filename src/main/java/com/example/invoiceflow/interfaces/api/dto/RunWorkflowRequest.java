package com.example.invoiceflow.interfaces.api.dto;

import com.example.invoiceflow.domain.model.WorkflowTask;

/**
 * Request body of a workflow run.
 *
 * @param workflow name of the workflow definition
 * @param task     task payload; absent means an empty task
 */
public record RunWorkflowRequest(String workflow, WorkflowTask task) {
}
