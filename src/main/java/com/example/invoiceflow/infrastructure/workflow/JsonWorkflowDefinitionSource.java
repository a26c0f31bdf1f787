package com.example.invoiceflow.infrastructure.workflow;

import com.example.invoiceflow.domain.exception.WorkflowDefinitionNotFoundException;
import com.example.invoiceflow.domain.model.WorkflowDefinition;
import com.example.invoiceflow.domain.port.WorkflowDefinitionSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Pattern;

/**
 * Loads workflow definitions from {@code <location>/<name>.json}. The definition's name defaults to the
 * file name when the JSON does not carry one.
 */
@Service
@EnableConfigurationProperties(WorkflowProperties.class)
public class JsonWorkflowDefinitionSource implements WorkflowDefinitionSource {

    private static final Logger log = LoggerFactory.getLogger(JsonWorkflowDefinitionSource.class);
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    /**
     * @param resourceLoader loader for {@code classpath:} and {@code file:} locations
     * @param objectMapper   mapper used to bind definition files
     * @param properties     configured definition location
     */
    public JsonWorkflowDefinitionSource(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                        WorkflowProperties properties) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        String configured = properties.location();
        this.location = configured.endsWith("/") ? configured : configured + "/";
    }

    @Override
    public WorkflowDefinition load(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new WorkflowDefinitionNotFoundException(name);
        }
        Resource resource = resourceLoader.getResource(location + name + ".json");
        if (!resource.exists()) {
            throw new WorkflowDefinitionNotFoundException(name);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            WorkflowDefinition definition = objectMapper.readValue(inputStream, WorkflowDefinition.class);
            if (definition == null) {
                throw new WorkflowDefinitionNotFoundException(name);
            }
            log.debug("Loaded workflow {} with steps {}", name, definition.stepIds());
            if (definition.name() == null || definition.name().isBlank()) {
                return new WorkflowDefinition(name, definition.steps());
            }
            return definition;
        } catch (IOException ex) {
            throw new WorkflowDefinitionNotFoundException(name, ex);
        }
    }
}
