package io.secondbrain.memory;

/** A memory's latest flag changed between read and write. */
public class ConcurrencyConflictException extends RuntimeException {

    private final String memoryId;

    public ConcurrencyConflictException(String memoryId, long expectedVersion) {
        super("Memory %s changed concurrently (expected version %d)".formatted(memoryId, expectedVersion));
        this.memoryId = memoryId;
    }

    public String getMemoryId() {
        return memoryId;
    }
}
