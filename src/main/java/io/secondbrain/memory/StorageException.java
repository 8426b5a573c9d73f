package io.secondbrain.memory;

/** The durable store failed or returned unreadable data. The operation in progress wrote nothing. */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
