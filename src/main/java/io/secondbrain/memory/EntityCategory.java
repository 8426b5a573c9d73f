package io.secondbrain.memory;

/** Categories of named entities extracted from memory text. */
public enum EntityCategory {
    PERSON,
    ORGANIZATION,
    LOCATION,
    EMAIL,
    URL,
    PHONE;

    public static EntityCategory fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Entity category is required");
        }
        return switch (s.trim().toLowerCase()) {
            case "person", "people" -> PERSON;
            case "organization", "organisation", "org" -> ORGANIZATION;
            case "location", "place" -> LOCATION;
            case "email" -> EMAIL;
            case "url", "link" -> URL;
            case "phone" -> PHONE;
            default -> throw new IllegalArgumentException("Unknown entity category: " + s);
        };
    }
}
