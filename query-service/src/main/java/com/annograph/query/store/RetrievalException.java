package com.annograph.query.store;

/**
 * The entity store could not answer a retrieval. Distinct from an empty result.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
