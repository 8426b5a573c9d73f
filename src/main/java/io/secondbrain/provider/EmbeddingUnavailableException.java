package io.secondbrain.provider;

/** The embedding provider could not produce a vector. */
public class EmbeddingUnavailableException extends ExternalServiceException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
