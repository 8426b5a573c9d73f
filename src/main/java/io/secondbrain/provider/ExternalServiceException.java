package io.secondbrain.provider;

/**
 * A transient failure of an external provider: timeout, throttling or server error.
 * Safe to retry, since every provider call is a pure function of its input text.
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
