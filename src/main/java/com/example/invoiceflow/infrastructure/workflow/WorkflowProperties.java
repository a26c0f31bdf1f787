package com.example.invoiceflow.infrastructure.workflow;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Workflow definition settings bound from {@code invoice.workflow.*}.
 *
 * @param location resource location holding one {@code <name>.json} file per workflow
 */
@ConfigurationProperties(prefix = "invoice.workflow")
public record WorkflowProperties(
        @DefaultValue("classpath:workflow/") String location
) {
}
