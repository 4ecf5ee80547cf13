package com.umitunal.cronq.core;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A collection of JSON documents that job workers coordinate through.
 *
 * Every document is identified by the string in its {@value #ID_FIELD} field.
 * The engine only calls {@link #findOneAndUpdate}, {@link #updateOne} and
 * {@link #deleteOne}; the remaining operations are for producers and tooling.
 */
public interface DocumentStore extends AutoCloseable {

    String ID_FIELD = "_id";

    /**
     * Atomically select one document matching the filter and apply the update to it.
     * Two concurrent callers never receive the same document for the same state.
     * Selection order among several matches is implementation defined.
     *
     * @return the document after the update, or null if no document matches
     */
    ObjectNode findOneAndUpdate(DocumentFilter filter, DocumentUpdate update) throws StoreException;

    /**
     * Apply an update to the document with the given id.
     *
     * @return true if the document existed
     */
    boolean updateOne(String id, DocumentUpdate update) throws StoreException;

    /**
     * Delete the document with the given id.
     *
     * @return true if a document was deleted
     */
    boolean deleteOne(String id) throws StoreException;

    /**
     * Insert or replace a document. A random id is assigned when the document has none.
     *
     * @return the document id
     */
    String insert(ObjectNode document) throws StoreException;

    /**
     * @return a copy of the stored document, or null if absent
     */
    ObjectNode findById(String id) throws StoreException;

    long count() throws StoreException;

    @Override
    void close();
}
