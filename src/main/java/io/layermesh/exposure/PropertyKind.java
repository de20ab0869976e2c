package io.layermesh.exposure;

public enum PropertyKind {
    FIELD("field"),
    METHOD("method");

    private final String wireName;

    PropertyKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PropertyKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("property kind cannot be empty");
        }
        for (PropertyKind value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown property kind (expected field or method): " + raw);
    }
}
