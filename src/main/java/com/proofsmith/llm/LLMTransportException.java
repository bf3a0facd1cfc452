package com.proofsmith.llm;

/**
 * Thrown when a generative-service or embedding call still fails after the retry
 * budget is exhausted.
 */
public class LLMTransportException extends RuntimeException {

    public LLMTransportException(String message) {
        super(message);
    }

    public LLMTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
