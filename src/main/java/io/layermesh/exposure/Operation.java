package io.layermesh.exposure;

/**
 * What a remote caller wants to do with a property.
 */
public enum Operation {
    GET("get"),
    SET("set"),
    CALL("call");

    private final String wireName;

    Operation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Operation fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("operation cannot be empty");
        }
        for (Operation value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + raw);
    }
}
