package com.umitunal.cronq.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Predicate over stored documents.
 */
@FunctionalInterface
public interface DocumentFilter {

    boolean matches(JsonNode document);

    default DocumentFilter and(DocumentFilter other) {
        return document -> matches(document) && other.matches(document);
    }

    static DocumentFilter all() {
        return document -> true;
    }

    /**
     * Matches documents where the path is present, including an explicit JSON null.
     */
    static DocumentFilter exists(String path) {
        FieldPath field = FieldPath.of(path);
        return field::exists;
    }

    /**
     * Matches documents whose timestamp at the path is null or not after the given instant.
     * A missing field does not match.
     */
    static DocumentFilter dueBy(String path, Instant instant) {
        FieldPath field = FieldPath.of(path);
        return document -> {
            JsonNode value = field.resolve(document);
            if (value == null) {
                return false;
            }
            if (value.isNull()) {
                return true;
            }
            Instant at = Timestamps.read(value);
            return at != null && !at.isAfter(instant);
        };
    }

    static DocumentFilter equalTo(String path, JsonNode expected) {
        FieldPath field = FieldPath.of(path);
        return document -> expected.equals(field.resolve(document));
    }

    static DocumentFilter and(DocumentFilter... filters) {
        List<DocumentFilter> parts = Arrays.asList(filters);
        return document -> {
            for (DocumentFilter filter : parts) {
                if (!filter.matches(document)) {
                    return false;
                }
            }
            return true;
        };
    }
}
