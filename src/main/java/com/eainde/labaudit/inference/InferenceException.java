package com.eainde.labaudit.inference;

/**
 * A hosted inference call failed or returned nothing usable.
 */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
