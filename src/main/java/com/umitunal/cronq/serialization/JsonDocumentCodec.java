package com.umitunal.cronq.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * UTF-8 JSON encoding using Jackson.
 */
public class JsonDocumentCodec implements DocumentCodec {
    private final ObjectMapper mapper;

    public JsonDocumentCodec() {
        this(new ObjectMapper());
    }

    public JsonDocumentCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(ObjectNode document) {
        try {
            return mapper.writeValueAsBytes(document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize document to JSON", e);
        }
    }

    @Override
    public ObjectNode decode(byte[] bytes) {
        JsonNode node;
        try {
            node = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to deserialize document from JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Stored value is not a JSON object");
        }
        return (ObjectNode) node;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
