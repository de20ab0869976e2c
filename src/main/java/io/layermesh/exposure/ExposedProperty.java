package io.layermesh.exposure;

import java.util.Map;
import java.util.Set;

/**
 * One entry of an exposure table. A {@code null} permission means "unset", which leaves the
 * decision to the owner.
 */
public record ExposedProperty(
        String name,
        PropertyKind kind,
        Permission read,
        Permission write,
        Permission call
) {
    private static final Set<String> FIELD_SETTINGS = Set.of("read", "write");
    private static final Set<String> METHOD_SETTINGS = Set.of("call");

    public ExposedProperty {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("exposed property name cannot be empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("exposed property kind is required: " + name);
        }
        if (kind == PropertyKind.FIELD && call != null) {
            throw new IllegalArgumentException("a field cannot carry a call permission: " + name);
        }
        if (kind == PropertyKind.METHOD && (read != null || write != null)) {
            throw new IllegalArgumentException("a method cannot carry read/write permissions: " + name);
        }
    }

    public static ExposedProperty field(String name, Permission read, Permission write) {
        return new ExposedProperty(name, PropertyKind.FIELD, read, write, null);
    }

    public static ExposedProperty method(String name, Permission call) {
        return new ExposedProperty(name, PropertyKind.METHOD, null, null, call);
    }

    /**
     * Builds an entry from a settings map keyed by {@code read}/{@code write} (fields) or
     * {@code call} (methods). Any other key is rejected.
     */
    public static ExposedProperty of(String name, PropertyKind kind, Map<String, Permission> settings) {
        Map<String, Permission> safe = settings == null ? Map.of() : settings;
        Set<String> allowed = kind == PropertyKind.FIELD ? FIELD_SETTINGS : METHOD_SETTINGS;
        for (String key : safe.keySet()) {
            if (!allowed.contains(key)) {
                throw new IllegalArgumentException(
                        "Unexpected setting '" + key + "' for " + kind.wireName() + " '" + name + "' (allowed: " + allowed + ")");
            }
        }
        if (kind == PropertyKind.FIELD) {
            return field(name, safe.get("read"), safe.get("write"));
        }
        return method(name, safe.get("call"));
    }

    public boolean supports(Operation operation) {
        return switch (operation) {
            case GET, SET -> kind == PropertyKind.FIELD;
            case CALL -> kind == PropertyKind.METHOD;
        };
    }

    public Permission settingFor(Operation operation) {
        return switch (operation) {
            case GET -> read;
            case SET -> write;
            case CALL -> call;
        };
    }
}
