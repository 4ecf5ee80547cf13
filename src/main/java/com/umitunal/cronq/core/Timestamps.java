package com.umitunal.cronq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Timestamp encoding inside documents.
 *
 * Instants are written as epoch milliseconds. Numbers (fractions truncated) and
 * ISO-8601 strings are accepted when reading.
 */
public final class Timestamps {

    private Timestamps() {}

    public static JsonNode write(Instant instant) {
        return LongNode.valueOf(instant.toEpochMilli());
    }

    /**
     * @return the instant, or null when the node is missing, a JSON null, or not a timestamp
     */
    public static Instant read(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }
}
