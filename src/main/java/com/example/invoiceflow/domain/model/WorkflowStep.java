package com.example.invoiceflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One step of a workflow definition. Only the identifier matters; other fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowStep(@JsonProperty("id") String id) {
}
