package com.umitunal.cronq.serialization;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts stored documents to and from bytes.
 */
public interface DocumentCodec {

    byte[] encode(ObjectNode document);

    /**
     * @throws IllegalArgumentException if the bytes do not hold a JSON object
     */
    ObjectNode decode(byte[] bytes);
}
