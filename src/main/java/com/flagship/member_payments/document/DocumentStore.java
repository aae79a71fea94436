package com.flagship.member_payments.document;

/**
 * Blob storage for rendered documents.
 */
public interface DocumentStore {

    /**
     * Stores the content under {@code name}, replacing any previous content, and
     * returns a URL members can use to fetch it.
     */
    String store(String name, byte[] content, String contentType);
}
