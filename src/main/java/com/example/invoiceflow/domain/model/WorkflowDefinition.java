package com.example.invoiceflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Named, ordered list of workflow steps. Step order is execution order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowDefinition(
        String name,
        List<WorkflowStep> steps
) {

    public WorkflowDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * @return step identifiers in execution order
     */
    public List<String> stepIds() {
        return steps.stream().map(WorkflowStep::id).toList();
    }
}
