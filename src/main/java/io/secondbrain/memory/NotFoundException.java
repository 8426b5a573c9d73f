package io.secondbrain.memory;

/** An unknown memory or document id. */
public class NotFoundException extends RuntimeException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super("%s not found: %s".formatted(kind, id));
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
