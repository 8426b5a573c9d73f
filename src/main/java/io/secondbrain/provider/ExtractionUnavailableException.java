package io.secondbrain.provider;

/** The entity/keyword extractor could not process the text. */
public class ExtractionUnavailableException extends ExternalServiceException {

    public ExtractionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
