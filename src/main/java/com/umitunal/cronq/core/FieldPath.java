package com.umitunal.cronq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.List;

/**
 * Dotted path into a JSON document, e.g. {@code schedule.sleepUntil}.
 */
public final class FieldPath {
    private final String path;
    private final List<String> segments;

    private FieldPath(String path) {
        this.path = path;
        this.segments = Arrays.asList(path.split("\\."));
    }

    public static FieldPath of(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Field path must not be empty");
        }
        if (path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
            throw new IllegalArgumentException("Invalid field path: " + path);
        }
        return new FieldPath(path);
    }

    /**
     * Resolve the node at this path.
     *
     * @return the node (possibly a JSON null), or null when the path does not exist
     */
    public JsonNode resolve(JsonNode document) {
        JsonNode current = document;
        for (String segment : segments) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    public boolean exists(JsonNode document) {
        return resolve(document) != null;
    }

    /**
     * Set the value at this path, creating intermediate objects as needed.
     * An intermediate value that is not an object is replaced.
     */
    public void set(ObjectNode document, JsonNode value) {
        ObjectNode parent = document;
        for (String segment : segments.subList(0, segments.size() - 1)) {
            JsonNode child = parent.get(segment);
            if (child == null || !child.isObject()) {
                child = parent.putObject(segment);
            }
            parent = (ObjectNode) child;
        }
        parent.set(leaf(), value);
    }

    /**
     * Remove the field at this path.
     *
     * @return true if a field was removed
     */
    public boolean unset(ObjectNode document) {
        JsonNode parent = document;
        for (String segment : segments.subList(0, segments.size() - 1)) {
            parent = parent.get(segment);
            if (parent == null || !parent.isObject()) {
                return false;
            }
        }
        return ((ObjectNode) parent).remove(leaf()) != null;
    }

    private String leaf() {
        return segments.get(segments.size() - 1);
    }

    public String getPath() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPath)) return false;
        return path.equals(((FieldPath) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
