package com.example.invoiceflow.domain.port;

import com.example.invoiceflow.domain.model.WorkflowDefinition;

/**
 * Read-only source of named workflow definitions.
 */
public interface WorkflowDefinitionSource {

    /**
     * @param name simple workflow name
     * @return the definition registered under that name
     * @throws com.example.invoiceflow.domain.exception.WorkflowDefinitionNotFoundException when no such workflow exists
     */
    WorkflowDefinition load(String name);
}
