package com.example.invoiceflow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task payload handed to a workflow run.
 * {@code document} holds a single document URI, {@code documents} an ordered list used when a workflow
 * parses several inputs. Every other field of the incoming JSON object is kept in {@code attributes}
 * and echoed back untouched.
 */
public record WorkflowTask(
        String document,
        List<String> documents,
        Map<String, Object> attributes
) {

    static final String DOCUMENT_FIELD = "document";
    static final String DOCUMENTS_FIELD = "documents";

    public WorkflowTask {
        documents = documents == null ? List.of() : List.copyOf(documents);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static WorkflowTask empty() {
        return new WorkflowTask(null, List.of(), Map.of());
    }

    public static WorkflowTask ofDocument(String documentUri) {
        return new WorkflowTask(documentUri, List.of(), Map.of());
    }

    public static WorkflowTask ofDocuments(List<String> documentUris) {
        return new WorkflowTask(null, documentUris, Map.of());
    }

    /**
     * Builds a task from a loosely typed JSON object. Non-string entries of {@code documents} are skipped.
     *
     * @param payload JSON object supplied by the caller (may be {@code null})
     * @return typed task
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static WorkflowTask fromPayload(Map<String, Object> payload) {
        if (payload == null) {
            return empty();
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        String document = null;
        List<String> documents = new ArrayList<>();
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            Object value = entry.getValue();
            if (DOCUMENT_FIELD.equals(entry.getKey())) {
                document = value instanceof String text && !text.isBlank() ? text : null;
            } else if (DOCUMENTS_FIELD.equals(entry.getKey()) && value instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof String text && !text.isBlank()) {
                        documents.add(text);
                    }
                }
            } else if (value != null) {
                attributes.put(entry.getKey(), value);
            }
        }
        return new WorkflowTask(document, documents, attributes);
    }

    /**
     * Resolves the document URI for the given occurrence of a parse step.
     *
     * @param occurrence zero-based index of the parse step among its repeats
     * @return {@code documents[occurrence]} when present, otherwise {@code document}, otherwise {@code null}
     */
    public String documentFor(int occurrence) {
        if (occurrence >= 0 && occurrence < documents.size()) {
            return documents.get(occurrence);
        }
        return document;
    }

    /**
     * @return JSON shape of the task, mirroring what {@link #fromPayload(Map)} accepts
     */
    @JsonValue
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>(attributes);
        if (document != null) {
            payload.put(DOCUMENT_FIELD, document);
        }
        if (!documents.isEmpty()) {
            payload.put(DOCUMENTS_FIELD, documents);
        }
        return payload;
    }
}
