package com.eainde.manuscript.llm;

/**
 * The model answered, but not with something the adapter could use.
 */
public class ModelResponseException extends RuntimeException {

    public ModelResponseException(String message) {
        super(message);
    }

    public ModelResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
