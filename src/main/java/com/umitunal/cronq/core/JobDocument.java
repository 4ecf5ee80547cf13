package com.umitunal.cronq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * A job claimed from the store: the document as it looked right after the claim,
 * plus the instant at which the claim happened.
 */
public class JobDocument {
    private final ObjectNode document;
    private final Instant lockedAt;

    public JobDocument(ObjectNode document, Instant lockedAt) {
        this.document = document;
        this.lockedAt = lockedAt;
    }

    public String getId() {
        JsonNode id = document.get(DocumentStore.ID_FIELD);
        return id == null || id.isNull() ? null : id.asText();
    }

    /**
     * The underlying document. Changes made by a processor are not persisted.
     */
    public ObjectNode getDocument() {
        return document;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    /**
     * @return the node at a dotted path, or null if absent
     */
    public JsonNode get(String path) {
        return FieldPath.of(path).resolve(document);
    }

    public String getText(String path) {
        JsonNode node = get(path);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    public Instant getInstant(String path) {
        return Timestamps.read(get(path));
    }

    public boolean isTrue(String path) {
        JsonNode node = get(path);
        return node != null && node.isBoolean() && node.booleanValue();
    }

    @Override
    public String toString() {
        return String.format("JobDocument{id='%s', lockedAt=%s}", getId(), lockedAt);
    }
}
