package com.proofsmith.core.retrieval;

/** The on-disk index is missing, unreadable or inconsistent. */
public class IndexStoreException extends Exception {

    public IndexStoreException(String message) {
        super(message);
    }

    public IndexStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
