package com.umitunal.cronq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of field modifications applied to a single document.
 */
public final class DocumentUpdate {
    private final List<Operation> operations;

    private DocumentUpdate(List<Operation> operations) {
        this.operations = operations;
    }

    public static DocumentUpdate set(String path, JsonNode value) {
        return new DocumentUpdate(List.of()).andSet(path, value);
    }

    public static DocumentUpdate setInstant(String path, Instant instant) {
        return set(path, Timestamps.write(instant));
    }

    public static DocumentUpdate unset(String path) {
        return new DocumentUpdate(List.of()).andUnset(path);
    }

    public DocumentUpdate andSet(String path, JsonNode value) {
        return with(new Operation(FieldPath.of(path), value.deepCopy()));
    }

    public DocumentUpdate andUnset(String path) {
        return with(new Operation(FieldPath.of(path), null));
    }

    private DocumentUpdate with(Operation operation) {
        List<Operation> next = new ArrayList<>(operations);
        next.add(operation);
        return new DocumentUpdate(Collections.unmodifiableList(next));
    }

    /**
     * Apply all operations to the document in place.
     */
    public void applyTo(ObjectNode document) {
        for (Operation operation : operations) {
            if (operation.value == null) {
                operation.field.unset(document);
            } else {
                operation.field.set(document, operation.value.deepCopy());
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DocumentUpdate{");
        for (int i = 0; i < operations.size(); i++) {
            Operation operation = operations.get(i);
            if (i > 0) sb.append(", ");
            if (operation.value == null) {
                sb.append("unset ").append(operation.field);
            } else {
                sb.append("set ").append(operation.field).append('=').append(operation.value);
            }
        }
        return sb.append('}').toString();
    }

    private static final class Operation {
        private final FieldPath field;
        private final JsonNode value;  // null means unset

        private Operation(FieldPath field, JsonNode value) {
            this.field = field;
            this.value = value;
        }
    }
}
