package com.umitunal.cronq.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.cronq.core.DocumentFilter;
import com.umitunal.cronq.core.DocumentStore;
import com.umitunal.cronq.core.DocumentUpdate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Heap-only document collection. Every operation holds the instance monitor,
 * which makes {@link #findOneAndUpdate} atomic across threads.
 *
 * Documents are iterated in insertion order and always copied on the way in and out.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private final Map<String, ObjectNode> documents = new LinkedHashMap<>();

    @Override
    public synchronized ObjectNode findOneAndUpdate(DocumentFilter filter, DocumentUpdate update) {
        for (ObjectNode document : documents.values()) {
            if (filter.matches(document)) {
                update.applyTo(document);
                return document.deepCopy();
            }
        }
        return null;
    }

    @Override
    public synchronized boolean updateOne(String id, DocumentUpdate update) {
        ObjectNode document = documents.get(id);
        if (document == null) {
            return false;
        }
        update.applyTo(document);
        return true;
    }

    @Override
    public synchronized boolean deleteOne(String id) {
        return documents.remove(id) != null;
    }

    @Override
    public synchronized String insert(ObjectNode document) {
        ObjectNode copy = document.deepCopy();
        JsonNode idNode = copy.get(ID_FIELD);
        String id = idNode == null || idNode.isNull() ? UUID.randomUUID().toString() : idNode.asText();
        copy.put(ID_FIELD, id);
        documents.put(id, copy);
        return id;
    }

    @Override
    public synchronized ObjectNode findById(String id) {
        ObjectNode document = documents.get(id);
        return document == null ? null : document.deepCopy();
    }

    @Override
    public synchronized long count() {
        return documents.size();
    }

    @Override
    public synchronized void close() {
        documents.clear();
    }
}
