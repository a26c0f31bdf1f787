package com.example.invoiceflow.application.service;

import com.example.invoiceflow.domain.exception.WorkflowNameRequiredException;
import com.example.invoiceflow.domain.model.ExecutionContext;
import com.example.invoiceflow.domain.model.WorkflowDefinition;
import com.example.invoiceflow.domain.model.WorkflowTask;
import com.example.invoiceflow.domain.port.WorkflowDefinitionSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Loads a named workflow definition and runs it.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowDefinitionSource definitionSource;
    private final WorkflowExecutor executor;

    /**
     * @param definitionSource where named definitions are loaded from
     * @param executor         runs a loaded definition
     */
    public WorkflowService(WorkflowDefinitionSource definitionSource, WorkflowExecutor executor) {
        this.definitionSource = definitionSource;
        this.executor = executor;
    }

    /**
     * @param workflowName name of the definition to load
     * @param task         task payload, {@code null} treated as empty
     * @return execution context of the finished run
     * @throws WorkflowNameRequiredException when no name is given
     * @throws com.example.invoiceflow.domain.exception.WorkflowDefinitionNotFoundException when the name is unknown
     * @throws com.example.invoiceflow.application.exception.WorkflowExecutionException when a step fails
     */
    public ExecutionContext run(String workflowName, WorkflowTask task) {
        if (workflowName == null || workflowName.isBlank()) {
            throw new WorkflowNameRequiredException();
        }
        WorkflowDefinition definition = definitionSource.load(workflowName.trim());
        log.info("Running workflow {} with steps {}", definition.name(), definition.stepIds());
        return executor.execute(definition, task == null ? WorkflowTask.empty() : task);
    }
}
